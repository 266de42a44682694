package personal.clinic.booking.appointment.application.port.out;

import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.store.StoreQuery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Appointment Repository (Output Port)
 */
public interface AppointmentRepository {

    Appointment save(Appointment appointment);

    /**
     * 예약 조회 (정규화 식별자 -> 원문 식별자 순서)
     */
    Optional<Appointment> findById(String appointmentId);

    List<Appointment> findAll(StoreQuery query);

    long count(StoreQuery query);

    long countDistinctPatients();

    /**
     * 리마인더 발송 권한 선점 (reminderSent false -> true 원자적 변경)
     *
     * @return 선점에 성공한 경우 true, 이미 다른 곳에서 선점했으면 false
     */
    boolean claimReminder(String appointmentId, Instant sentAt);
}
