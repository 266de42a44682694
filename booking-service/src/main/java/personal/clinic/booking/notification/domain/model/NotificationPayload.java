package personal.clinic.booking.notification.domain.model;

import java.util.Map;

/**
 * 작업 생성 시점의 수신자 정보와 템플릿 변수 스냅샷
 */
public record NotificationPayload(
        String recipientEmail,
        String recipientPhone,
        Map<String, String> variables
) {
    public NotificationPayload {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }
}
