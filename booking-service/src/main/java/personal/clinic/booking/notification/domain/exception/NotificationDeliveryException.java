package personal.clinic.booking.notification.domain.exception;

import personal.clinic.booking.notification.domain.model.NotificationChannel;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * 외부 발송 게이트웨이 실패 (응답 오류, 타임아웃, Circuit Open)
 * 요청 경로로 전파되지 않고 FAILED 로그로 기록된다.
 */
public class NotificationDeliveryException extends BusinessException {
    public NotificationDeliveryException(NotificationChannel channel, String reason) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR,
                String.format("Failed to deliver %s notification: %s", channel.value(), reason));
    }

    public NotificationDeliveryException(NotificationChannel channel, String reason, Throwable cause) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR,
                String.format("Failed to deliver %s notification: %s", channel.value(), reason), cause);
    }
}
