package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Reschedule Command
 */
public record RescheduleCommand(
        String appointmentId,
        Instant newStartTime,
        Instant newEndTime,
        String reason
) {
    public RescheduleCommand {
        if (appointmentId == null || appointmentId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment ID cannot be blank");
        }
        if (newStartTime == null || newEndTime == null) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, "New start time and end time are required");
        }
        if (!newStartTime.isBefore(newEndTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "New start time must be before new end time");
        }
    }
}
