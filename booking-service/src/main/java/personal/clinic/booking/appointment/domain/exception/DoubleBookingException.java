package personal.clinic.booking.appointment.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Double Booking Exception
 * 같은 의료진의 활성 예약과 시간이 겹치는 경우 (409 Conflict)
 * 응답 메시지는 환자에게 노출되는 기본 메시지를 사용
 */
public class DoubleBookingException extends BusinessException {

    private final String providerId;

    public DoubleBookingException(String providerId) {
        super(ErrorCode.DOUBLE_BOOKING);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
