package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;

/**
 * Book Appointment UseCase (Input Port)
 */
public interface BookAppointmentUseCase {

    /**
     * 예약 생성 (PENDING)
     * 겹침 검사와 저장은 의료진 락 안에서 원자적으로 수행된다.
     *
     * @throws personal.clinic.booking.appointment.domain.exception.DoubleBookingException      겹치는 활성 예약이 있을 때
     * @throws personal.clinic.booking.appointment.domain.exception.ConcurrentBookingException  동시 예약 경합에서 진 경우
     * @throws personal.clinic.booking.catalog.domain.exception.ProviderNotFoundException       의료진이 없을 때
     */
    Appointment book(BookAppointmentCommand command);
}
