package personal.clinic.booking.notification.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Notification Settings Domain Model
 * 클리닉 전체 알림 설정 (단일 레코드)
 *
 * @param reminderHoursBefore 리마인더 주기 점검 시 조회 범위 (시간)
 */
public record NotificationSettings(
        boolean notificationsEnabled,
        boolean emailNotificationsEnabled,
        boolean smsNotificationsEnabled,
        int reminderHoursBefore,
        boolean bookingApprovalRequired,
        Instant updatedAt) {

    public static final int MAX_REMINDER_HOURS = 168;

    public NotificationSettings {
        if (reminderHoursBefore < 1 || reminderHoursBefore > MAX_REMINDER_HOURS) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "reminderHoursBefore must be between 1 and " + MAX_REMINDER_HOURS + ": " + reminderHoursBefore);
        }
    }

    public boolean isEnabled(NotificationChannel channel) {
        if (!notificationsEnabled) {
            return false;
        }
        return switch (channel) {
            case EMAIL -> emailNotificationsEnabled;
            case SMS -> smsNotificationsEnabled;
        };
    }
}
