package personal.clinic.booking.appointment.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.clinic.booking.appointment.domain.model.TimeSlot;

import java.time.Instant;

/**
 * 예약 가능 시간대 응답 DTO (반환되는 시간대는 항상 예약 가능)
 */
public record TimeSlotResponse(
        Instant startTime,
        Instant endTime,
        @JsonProperty("isAvailable") boolean isAvailable
) {
    public static TimeSlotResponse from(TimeSlot slot) {
        return new TimeSlotResponse(slot.startTime(), slot.endTime(), true);
    }
}
