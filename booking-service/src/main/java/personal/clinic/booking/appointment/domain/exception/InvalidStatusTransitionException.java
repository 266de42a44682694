package personal.clinic.booking.appointment.domain.exception;

import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * 허용되지 않는 예약 상태 전환
 */
public class InvalidStatusTransitionException extends BusinessException {
    public InvalidStatusTransitionException(AppointmentStatus from, AppointmentStatus to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Cannot change appointment status from %s to %s", from.value(), to.value()));
    }

    public InvalidStatusTransitionException(AppointmentStatus current, String operation) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Cannot %s an appointment in %s status", operation, current.value()));
    }
}
