package personal.clinic.booking.notification.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.notification.domain.model.NotificationSettings;

import java.time.Instant;

/**
 * Notification Settings JPA Entity
 * 고정 ID 단일 행
 */
@Entity
@Table(name = "notification_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationSettingsEntity {

    static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "notifications_enabled", nullable = false)
    private boolean notificationsEnabled;

    @Column(name = "email_notifications_enabled", nullable = false)
    private boolean emailNotificationsEnabled;

    @Column(name = "sms_notifications_enabled", nullable = false)
    private boolean smsNotificationsEnabled;

    @Column(name = "reminder_hours_before", nullable = false)
    private int reminderHoursBefore;

    @Column(name = "booking_approval_required", nullable = false)
    private boolean bookingApprovalRequired;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public static NotificationSettingsEntity fromDomain(NotificationSettings settings) {
        NotificationSettingsEntity entity = new NotificationSettingsEntity();
        entity.id = SINGLETON_ID;
        entity.notificationsEnabled = settings.notificationsEnabled();
        entity.emailNotificationsEnabled = settings.emailNotificationsEnabled();
        entity.smsNotificationsEnabled = settings.smsNotificationsEnabled();
        entity.reminderHoursBefore = settings.reminderHoursBefore();
        entity.bookingApprovalRequired = settings.bookingApprovalRequired();
        entity.updatedAt = settings.updatedAt();
        return entity;
    }

    public NotificationSettings toDomain() {
        return new NotificationSettings(notificationsEnabled, emailNotificationsEnabled, smsNotificationsEnabled,
                reminderHoursBefore, bookingApprovalRequired, updatedAt);
    }
}
