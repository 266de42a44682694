package personal.clinic.booking.notification.adapter.in.web.dto;

import personal.clinic.booking.notification.domain.model.DeliveryStatus;
import personal.clinic.booking.notification.domain.model.NotificationChannel;
import personal.clinic.booking.notification.domain.model.NotificationLog;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.time.Instant;

public record NotificationLogResponse(
        Long id,
        String appointmentId,
        NotificationType type,
        NotificationChannel channel,
        String recipient,
        DeliveryStatus status,
        String errorMessage,
        Instant createdAt
) {
    public static NotificationLogResponse from(NotificationLog log) {
        String recipient = log.channel() == NotificationChannel.EMAIL ? log.recipientEmail() : log.recipientPhone();
        return new NotificationLogResponse(log.id(), log.appointmentId(), log.type(), log.channel(), recipient,
                log.status(), log.errorMessage(), log.createdAt());
    }
}
