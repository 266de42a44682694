package personal.clinic.booking.notification.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.notification.domain.model.DeliveryStatus;
import personal.clinic.booking.notification.domain.model.NotificationChannel;
import personal.clinic.booking.notification.domain.model.NotificationLog;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.time.Instant;

/**
 * Notification Log JPA Entity
 */
@Entity
@Table(name = "notification_logs",
        indexes = {
                @Index(name = "idx_notification_log_appointment", columnList = "appointment_id"),
                @Index(name = "idx_notification_log_type_status", columnList = "notification_type, status")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appointment_id", nullable = false, length = 64)
    private String appointmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false, length = 40)
    private NotificationType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private NotificationChannel channel;

    @Column(name = "recipient_email", length = 200)
    private String recipientEmail;

    @Column(name = "recipient_phone", length = 40)
    private String recipientPhone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DeliveryStatus status;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static NotificationLogEntity fromDomain(NotificationLog log) {
        NotificationLogEntity entity = new NotificationLogEntity();
        entity.id = log.id();
        entity.appointmentId = log.appointmentId();
        entity.type = log.type();
        entity.channel = log.channel();
        entity.recipientEmail = log.recipientEmail();
        entity.recipientPhone = log.recipientPhone();
        entity.status = log.status();
        entity.errorMessage = NotificationJobEntity.truncate(log.errorMessage());
        entity.createdAt = log.createdAt();
        return entity;
    }

    public NotificationLog toDomain() {
        return new NotificationLog(id, appointmentId, type, channel, recipientEmail, recipientPhone, status,
                errorMessage, createdAt);
    }
}
