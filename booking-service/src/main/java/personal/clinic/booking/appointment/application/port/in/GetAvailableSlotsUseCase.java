package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.booking.appointment.domain.model.TimeSlot;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Available Slots UseCase (Input Port)
 */
public interface GetAvailableSlotsUseCase {

    /**
     * 예약 가능한 시간대 조회 (무작위 순서, 최대 설정 개수)
     *
     * @throws personal.clinic.booking.catalog.domain.exception.ProviderAvailabilityNotFoundException 근무 시간이 없을 때
     */
    List<TimeSlot> getAvailableSlots(String providerId, LocalDate date, int durationMinutes);
}
