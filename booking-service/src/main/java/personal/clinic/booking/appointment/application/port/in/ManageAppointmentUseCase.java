package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.audit.domain.model.StaffActor;

/**
 * Manage Appointment UseCase (Input Port)
 * 직원용 예약 변경 (상태 변경, 일정 변경, 취소)
 * 모든 변경은 감사 로그에 기록된다.
 */
public interface ManageAppointmentUseCase {

    /**
     * @throws personal.clinic.booking.appointment.domain.exception.InvalidStatusTransitionException 허용되지 않는 전환
     */
    Appointment updateStatus(String appointmentId, AppointmentStatus newStatus, StaffActor actor);

    /**
     * 일정 변경. 같은 의료진의 다른 활성 예약과 겹치면 409
     */
    Appointment reschedule(RescheduleCommand command, StaffActor actor);

    Appointment cancel(String appointmentId, StaffActor actor);
}
