package personal.clinic.booking.appointment.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Appointment Status Enum
 * 예약 상태
 */
public enum AppointmentStatus {
    /**
     * 예약 접수 (승인 대기)
     */
    PENDING,

    /**
     * 승인 완료
     */
    CONFIRMED,

    /**
     * 진료 완료
     */
    COMPLETED,

    /**
     * 취소
     */
    CANCELLED;

    /**
     * 시간대를 점유하는 상태
     */
    public static final Set<AppointmentStatus> ACTIVE = EnumSet.of(PENDING, CONFIRMED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * pending -> confirmed, {pending, confirmed} -> completed | cancelled
     */
    public boolean canTransitionTo(AppointmentStatus next) {
        return switch (this) {
            case PENDING -> next == CONFIRMED || next == COMPLETED || next == CANCELLED;
            case CONFIRMED -> next == COMPLETED || next == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AppointmentStatus from(String value) {
        if (value == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Status is required");
        }
        for (AppointmentStatus status : values()) {
            if (status.value().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new BusinessException(ErrorCode.INVALID_INPUT, "Invalid status: " + value);
    }
}
