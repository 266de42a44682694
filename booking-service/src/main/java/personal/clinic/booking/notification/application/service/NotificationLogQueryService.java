package personal.clinic.booking.notification.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.notification.application.port.in.QueryNotificationLogsUseCase;
import personal.clinic.booking.notification.application.port.in.ReminderStats;
import personal.clinic.booking.notification.application.port.out.NotificationLogRepository;
import personal.clinic.booking.notification.domain.model.DeliveryStatus;
import personal.clinic.booking.notification.domain.model.NotificationLog;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NotificationLogQueryService implements QueryNotificationLogsUseCase {

    static final int RECENT_LOG_LIMIT = 100;

    private final NotificationLogRepository notificationLogRepository;

    @Override
    public List<NotificationLog> getRecentLogs(String appointmentId) {
        String filter = appointmentId == null || appointmentId.isBlank() ? null : appointmentId.trim();
        return notificationLogRepository.findRecent(filter, RECENT_LOG_LIMIT);
    }

    @Override
    public ReminderStats getReminderStats() {
        NotificationType type = NotificationType.APPOINTMENT_REMINDER;
        return new ReminderStats(
                notificationLogRepository.countByType(type),
                notificationLogRepository.countByTypeAndStatus(type, DeliveryStatus.SENT),
                notificationLogRepository.countByTypeAndStatus(type, DeliveryStatus.FAILED));
    }
}
