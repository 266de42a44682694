package personal.clinic.booking.notification.application.port.in;

/**
 * 알림 설정 변경 Command
 * null 필드는 기존 값 유지
 */
public record UpdateNotificationSettingsCommand(
        Boolean notificationsEnabled,
        Boolean emailNotificationsEnabled,
        Boolean smsNotificationsEnabled,
        Integer reminderHoursBefore,
        Boolean bookingApprovalRequired
) {
}
