package personal.clinic.booking.appointment.application.port.out;

import personal.clinic.booking.appointment.domain.model.Appointment;

/**
 * 리마인더 타이머 등록/해제 포트 (트랜잭션 커밋 후 호출)
 */
public interface ReminderSchedulingPort {

    void schedule(Appointment appointment);

    void cancel(String appointmentId);
}
