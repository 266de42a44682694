package personal.clinic.booking.appointment.application.port.in;

/**
 * Search Appointments UseCase (Input Port)
 * 직원용 예약 목록/통계
 */
public interface SearchAppointmentsUseCase {

    AppointmentPage search(AppointmentSearchQuery query);

    AppointmentStats stats();
}
