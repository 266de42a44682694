package personal.clinic.booking.notification.application.port.out;

import personal.clinic.booking.notification.domain.model.DeliveryStatus;
import personal.clinic.booking.notification.domain.model.NotificationLog;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.util.List;

/**
 * Notification Log Repository (Output Port)
 */
public interface NotificationLogRepository {

    NotificationLog save(NotificationLog log);

    /**
     * 최신순 조회
     *
     * @param appointmentId null이면 전체
     */
    List<NotificationLog> findRecent(String appointmentId, int limit);

    long countByType(NotificationType type);

    long countByTypeAndStatus(NotificationType type, DeliveryStatus status);
}
