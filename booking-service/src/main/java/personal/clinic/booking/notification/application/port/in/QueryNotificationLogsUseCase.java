package personal.clinic.booking.notification.application.port.in;

import personal.clinic.booking.notification.domain.model.NotificationLog;

import java.util.List;

/**
 * Query Notification Logs UseCase (Input Port)
 */
public interface QueryNotificationLogsUseCase {

    /**
     * 최근 100건 (최신순)
     *
     * @param appointmentId null이면 전체
     */
    List<NotificationLog> getRecentLogs(String appointmentId);

    ReminderStats getReminderStats();
}
