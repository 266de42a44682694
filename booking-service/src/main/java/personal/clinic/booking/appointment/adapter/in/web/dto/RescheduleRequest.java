package personal.clinic.booking.appointment.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.clinic.booking.appointment.application.port.in.RescheduleCommand;

import java.time.Instant;

/**
 * 일정 변경 요청 DTO
 */
public record RescheduleRequest(
        @NotNull(message = "New start time is required")
        Instant newStartTime,

        @NotNull(message = "New end time is required")
        Instant newEndTime,

        @Size(max = 1000, message = "Reason must be at most 1000 characters")
        String reason
) {
    public RescheduleCommand toCommand(String appointmentId) {
        return new RescheduleCommand(appointmentId, newStartTime, newEndTime, reason);
    }
}
