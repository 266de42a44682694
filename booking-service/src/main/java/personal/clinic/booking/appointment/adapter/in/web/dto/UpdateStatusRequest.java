package personal.clinic.booking.appointment.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;

public record UpdateStatusRequest(
        @NotNull(message = "Status is required")
        AppointmentStatus status
) {
}
