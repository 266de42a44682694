package personal.clinic.booking.notification.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import personal.clinic.booking.notification.application.port.in.UpdateNotificationSettingsCommand;
import personal.clinic.booking.notification.domain.model.NotificationSettings;

/**
 * 알림 설정 변경 요청 (생략한 필드는 기존 값 유지)
 */
public record NotificationSettingsRequest(
        Boolean notificationsEnabled,
        Boolean emailNotificationsEnabled,
        Boolean smsNotificationsEnabled,
        @Min(1) @Max(NotificationSettings.MAX_REMINDER_HOURS) Integer reminderHoursBefore,
        Boolean bookingApprovalRequired
) {
    public UpdateNotificationSettingsCommand toCommand() {
        return new UpdateNotificationSettingsCommand(notificationsEnabled, emailNotificationsEnabled,
                smsNotificationsEnabled, reminderHoursBefore, bookingApprovalRequired);
    }
}
