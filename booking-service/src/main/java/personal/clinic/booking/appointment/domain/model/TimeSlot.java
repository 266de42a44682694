package personal.clinic.booking.appointment.domain.model;

import java.time.Instant;

/**
 * 예약 가능한 시간대 (조회 결과로만 존재하며 저장되지 않음)
 */
public record TimeSlot(Instant startTime, Instant endTime) {

    public TimeInterval interval() {
        return new TimeInterval(startTime, endTime);
    }
}
