package personal.clinic.booking.notification.domain.model;

/**
 * 알림 종류별 템플릿 ({{var}} 치환, {{#var}}...{{/var}} 조건부 구간)
 */
public record NotificationTemplate(
        String emailSubject,
        String emailBody,
        String smsText
) {
}
