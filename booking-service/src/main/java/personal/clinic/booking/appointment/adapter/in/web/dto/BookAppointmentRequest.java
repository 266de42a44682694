package personal.clinic.booking.appointment.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import personal.clinic.booking.appointment.application.port.in.BookAppointmentCommand;

import java.time.Instant;
import java.util.Map;

/**
 * 예약 생성 요청 DTO
 */
public record BookAppointmentRequest(
        @NotBlank(message = "Provider ID is required")
        String providerId,

        @NotBlank(message = "Service ID is required")
        String serviceId,

        @NotNull(message = "Start time is required")
        Instant startTime,

        @NotNull(message = "End time is required")
        Instant endTime,

        @NotBlank(message = "Patient name is required")
        String patientName,

        @NotBlank(message = "Patient email is required")
        String patientEmail,

        @NotBlank(message = "Patient phone is required")
        String patientPhone,

        Map<String, String> customFieldValues
) {
    public BookAppointmentCommand toCommand() {
        return new BookAppointmentCommand(providerId, serviceId, startTime, endTime,
                patientName, patientEmail, patientPhone, customFieldValues);
    }
}
