package personal.clinic.booking.notification.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.clinic.booking.notification.domain.model.NotificationTemplate;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TemplateRenderer 단위 테스트")
class TemplateRendererTest {

    @Test
    @DisplayName("변수를 치환하고 없는 변수는 빈 문자열로 남긴다")
    void substitutesVariables() {
        String rendered = TemplateRenderer.render("Hello {{patientName}}, {{missing}}see you",
                Map.of("patientName", "Jane"));

        assertThat(rendered).isEqualTo("Hello Jane, see you");
    }

    @Test
    @DisplayName("값에 $ 나 \\ 가 있어도 그대로 출력한다")
    void keepsSpecialCharacters() {
        assertThat(TemplateRenderer.render("Fee: {{fee}}", Map.of("fee", "$20 \\ visit")))
                .isEqualTo("Fee: $20 \\ visit");
    }

    @Test
    @DisplayName("조건부 구간은 값이 비어 있으면 통째로 제거된다")
    void removesBlankSection() {
        String template = "A\n{{#reason}}Reason: {{reason}}\n{{/reason}}B";

        assertThat(TemplateRenderer.render(template, Map.of())).isEqualTo("A\nB");
        assertThat(TemplateRenderer.render(template, Map.of("reason", "  "))).isEqualTo("A\nB");
        assertThat(TemplateRenderer.render(template, Map.of("reason", "Doctor out")))
                .isEqualTo("A\nReason: Doctor out\nB");
    }

    @Test
    @DisplayName("일정 변경 메일은 사유가 있을 때만 사유 줄을 포함한다")
    void rescheduleTemplateReason() {
        NotificationTemplate template = NotificationTemplates.of(NotificationType.APPOINTMENT_RESCHEDULED);
        Map<String, String> variables = Map.of(
                "patientName", "Jane",
                "serviceName", "Checkup",
                "providerName", "Dr. Kim",
                "appointmentDate", "3/4/2030",
                "appointmentTime", "10:00 AM");

        String withoutReason = TemplateRenderer.render(template.emailBody(), variables);

        assertThat(withoutReason)
                .contains("New Date: 3/4/2030")
                .doesNotContain("Reason for reschedule")
                .doesNotContain("{{");
        assertThat(TemplateRenderer.render(template.emailSubject(), variables))
                .isEqualTo("Appointment Rescheduled - Checkup");
    }

    @Test
    @DisplayName("모든 알림 종류에 이메일/SMS 템플릿이 있다")
    void everyTypeHasTemplate() {
        for (NotificationType type : NotificationType.values()) {
            NotificationTemplate template = NotificationTemplates.of(type);
            assertThat(template).as(type.name()).isNotNull();
            assertThat(template.emailSubject()).isNotBlank();
            assertThat(template.emailBody()).isNotBlank();
            assertThat(template.smsText()).isNotBlank();
        }
    }
}
