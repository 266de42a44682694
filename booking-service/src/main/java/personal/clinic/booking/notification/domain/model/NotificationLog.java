package personal.clinic.booking.notification.domain.model;

import java.time.Instant;

/**
 * Notification Log Domain Model
 * 채널별 발송 시도 1건
 */
public record NotificationLog(
        Long id,
        String appointmentId,
        NotificationType type,
        NotificationChannel channel,
        String recipientEmail,
        String recipientPhone,
        DeliveryStatus status,
        String errorMessage,
        Instant createdAt) {

    public static NotificationLog sent(String appointmentId, NotificationType type, NotificationChannel channel,
                                       NotificationPayload payload, Instant now) {
        return new NotificationLog(null, appointmentId, type, channel,
                payload.recipientEmail(), payload.recipientPhone(), DeliveryStatus.SENT, null, now);
    }

    public static NotificationLog failed(String appointmentId, NotificationType type, NotificationChannel channel,
                                         NotificationPayload payload, String errorMessage, Instant now) {
        return new NotificationLog(null, appointmentId, type, channel,
                payload.recipientEmail(), payload.recipientPhone(), DeliveryStatus.FAILED, errorMessage, now);
    }
}
