package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;

import java.util.List;

/**
 * Get Appointment UseCase (Input Port)
 */
public interface GetAppointmentUseCase {

    Appointment getAppointment(String appointmentId);

    /**
     * 환자 이메일로 예약 이력 조회 (최신순, 서비스/의료진 이름 포함)
     */
    List<PatientAppointmentView> getPatientHistory(String email);
}
