package personal.clinic.booking.appointment.application.port.out;

import personal.clinic.booking.appointment.domain.model.Appointment;

/**
 * 예약 변경 알림 발행 포트
 * 예약 변경과 같은 트랜잭션에서 호출되어야 한다 (Transactional Outbox)
 */
public interface AppointmentNotificationPort {

    void bookingCreated(Appointment appointment);

    void statusChanged(Appointment appointment);

    void rescheduled(Appointment appointment, String reason);
}
