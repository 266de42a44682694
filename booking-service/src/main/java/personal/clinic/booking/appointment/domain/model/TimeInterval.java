package personal.clinic.booking.appointment.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;

/**
 * 반열린 시간 구간 [start, end)
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time and end time are required");
        }
        if (!start.isBefore(end)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Start time must be before end time: start=%s, end=%s", start, end));
        }
    }

    /**
     * 두 구간이 겹치는지 (끝점이 맞닿는 경우는 겹치지 않음)
     */
    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
