package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Book Appointment Command
 * 예약 생성 커맨드 (형식 검증 포함)
 */
public record BookAppointmentCommand(
        String providerId,
        String serviceId,
        Instant startTime,
        Instant endTime,
        String patientName,
        String patientEmail,
        String patientPhone,
        Map<String, String> customFieldValues
) {
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^[\\d\\s\\-+()]+$");
    private static final int MIN_PHONE_DIGITS = 10;

    public BookAppointmentCommand {
        requireText(patientName, "Patient name");
        requireText(patientEmail, "Patient email");
        requireText(patientPhone, "Patient phone");
        requireText(serviceId, "Service ID");
        requireText(providerId, "Provider ID");
        if (startTime == null) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, "Start time is required");
        }
        if (endTime == null) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, "End time is required");
        }
        if (!EMAIL.matcher(patientEmail.trim()).matches()) {
            throw new BusinessException(ErrorCode.INVALID_EMAIL, "Patient email is not a valid email address");
        }
        String phone = patientPhone.trim();
        if (!PHONE.matcher(phone).matches() || phone.replaceAll("\\D", "").length() < MIN_PHONE_DIGITS) {
            throw new BusinessException(ErrorCode.INVALID_PHONE, "Patient phone is not a valid phone number");
        }
        if (!startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time must be before end time");
        }
        customFieldValues = answeredOnly(customFieldValues);
    }

    /**
     * 답하지 않은(null) 커스텀 필드는 제외
     */
    private static Map<String, String> answeredOnly(Map<String, String> values) {
        if (values == null) {
            return Map.of();
        }
        return values.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, field + " is required");
        }
    }
}
