package personal.clinic.booking.notification.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.notification.domain.model.NotificationJob;
import personal.clinic.booking.notification.domain.model.NotificationJobStatus;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.time.Instant;

/**
 * Notification Job JPA Entity (Outbox)
 */
@Entity
@Table(name = "notification_jobs",
        indexes = @Index(name = "idx_notification_job_status_created", columnList = "status, created_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "appointment_id", nullable = false, length = 64)
    private String appointmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false, length = 40)
    private NotificationType type;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private NotificationJobStatus status;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    public static NotificationJobEntity fromDomain(NotificationJob job) {
        NotificationJobEntity entity = new NotificationJobEntity();
        entity.id = job.id();
        entity.appointmentId = job.appointmentId();
        entity.type = job.type();
        entity.payload = job.payload();
        entity.status = job.status();
        entity.errorMessage = truncate(job.errorMessage());
        entity.createdAt = job.createdAt();
        entity.processedAt = job.processedAt();
        return entity;
    }

    public NotificationJob toDomain() {
        return new NotificationJob(id, appointmentId, type, payload, status, errorMessage, createdAt, processedAt);
    }

    static String truncate(String message) {
        return message != null && message.length() > 1000 ? message.substring(0, 1000) : message;
    }
}
