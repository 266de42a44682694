package personal.clinic.booking.appointment.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * 예약을 찾을 수 없는 경우
 */
public class AppointmentNotFoundException extends BusinessException {
    public AppointmentNotFoundException(String appointmentId) {
        super(ErrorCode.APPOINTMENT_NOT_FOUND,
                String.format("Appointment not found: appointmentId=%s", appointmentId));
    }
}
