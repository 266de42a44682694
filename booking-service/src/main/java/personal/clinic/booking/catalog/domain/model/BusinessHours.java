package personal.clinic.booking.catalog.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalTime;

/**
 * 요일별 근무 시간 (불변)
 *
 * @param dayOfWeek 0=일요일 ... 6=토요일
 * @param open      근무일 여부
 * @param startTime 근무 시작 (open일 때 필수)
 * @param endTime   근무 종료 (open일 때 필수, startTime 이후)
 */
public record BusinessHours(
        int dayOfWeek,
        boolean open,
        LocalTime startTime,
        LocalTime endTime) {

    public BusinessHours {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "dayOfWeek must be between 0 (Sunday) and 6 (Saturday): " + dayOfWeek);
        }
        if (open) {
            if (startTime == null || endTime == null) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Open business hours require startTime and endTime: dayOfWeek=" + dayOfWeek);
            }
            if (!startTime.isBefore(endTime)) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Business hours startTime must be before endTime: dayOfWeek=" + dayOfWeek);
            }
        }
    }

    public static BusinessHours open(int dayOfWeek, LocalTime startTime, LocalTime endTime) {
        return new BusinessHours(dayOfWeek, true, startTime, endTime);
    }

    public static BusinessHours closed(int dayOfWeek) {
        return new BusinessHours(dayOfWeek, false, null, null);
    }
}
