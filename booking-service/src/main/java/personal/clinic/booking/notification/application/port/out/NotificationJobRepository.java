package personal.clinic.booking.notification.application.port.out;

import personal.clinic.booking.notification.domain.model.NotificationJob;

import java.util.List;

/**
 * Notification Job Repository (Output Port)
 */
public interface NotificationJobRepository {

    NotificationJob save(NotificationJob job);

    /**
     * PENDING 작업을 생성 순서대로 최대 limit건 조회
     */
    List<NotificationJob> findPending(int limit);
}
