package personal.clinic.booking.appointment.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Concurrent Booking Exception
 * 의료진 락 대기 시간 초과 또는 DB Unique Index 위반 등 동시 예약 충돌
 * 클라이언트에게는 일반 중복 예약과 같은 코드로 응답한다
 */
public class ConcurrentBookingException extends BusinessException {
    public ConcurrentBookingException(Throwable cause) {
        super(ErrorCode.DOUBLE_BOOKING, ErrorCode.DOUBLE_BOOKING.getMessage(), cause);
    }
}
