package personal.clinic.booking.appointment.application.port.in;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BookAppointmentCommand 입력 검증")
class BookAppointmentCommandTest {

    private static final Instant START = Instant.parse("2030-03-04T15:00:00Z");
    private static final Instant END = START.plusSeconds(1800);

    private static BookAppointmentCommand command(String name, String email, String phone, Instant end) {
        return new BookAppointmentCommand("provider-1", "service-1", START, end, name, email, phone, null);
    }

    private static ErrorCode errorCodeOf(Runnable action) {
        try {
            action.run();
        } catch (BusinessException e) {
            return e.getErrorCode();
        }
        throw new AssertionError("expected BusinessException");
    }

    @Test
    @DisplayName("올바른 입력은 통과한다")
    void acceptsValidInput() {
        BookAppointmentCommand command = command("Jane", "jane@example.com", "(555) 123-4567", END);

        assertThat(command.customFieldValues()).isEmpty();
    }

    @Test
    @DisplayName("이름이 비어 있으면 MISSING_REQUIRED_FIELD")
    void requiresName() {
        assertThat(errorCodeOf(() -> command(" ", "jane@example.com", "5551234567", END)))
                .isEqualTo(ErrorCode.MISSING_REQUIRED_FIELD);
    }

    @ParameterizedTest
    @ValueSource(strings = {"jane", "jane@example", "jane doe@example.com", "@example.com"})
    @DisplayName("이메일 형식이 틀리면 INVALID_EMAIL")
    void rejectsInvalidEmail(String email) {
        assertThat(errorCodeOf(() -> command("Jane", email, "5551234567", END)))
                .isEqualTo(ErrorCode.INVALID_EMAIL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"555-1234", "phone: 5551234567", "555123456"})
    @DisplayName("전화번호 형식이 틀리거나 숫자가 10자리 미만이면 INVALID_PHONE")
    void rejectsInvalidPhone(String phone) {
        assertThat(errorCodeOf(() -> command("Jane", "jane@example.com", phone, END)))
                .isEqualTo(ErrorCode.INVALID_PHONE);
    }

    @Test
    @DisplayName("종료 시각이 시작 시각보다 이르면 INVALID_INPUT")
    void rejectsInvertedInterval() {
        assertThatThrownBy(() -> command("Jane", "jane@example.com", "5551234567", START))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Start time must be before end time");
    }

    @Test
    @DisplayName("답하지 않은(null) 커스텀 필드는 제외하고 나머지는 유지한다")
    void dropsUnansweredCustomFields() {
        Map<String, String> answers = new HashMap<>();
        answers.put("notes", null);
        answers.put("insurance", "Acme");

        BookAppointmentCommand command = new BookAppointmentCommand("provider-1", "service-1", START, END,
                "Jane", "jane@example.com", "5551234567", answers);

        assertThat(command.customFieldValues()).containsExactly(Map.entry("insurance", "Acme"));
    }
}
