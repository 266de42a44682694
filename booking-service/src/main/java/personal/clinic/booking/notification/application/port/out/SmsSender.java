package personal.clinic.booking.notification.application.port.out;

/**
 * SMS 발송 (Output Port)
 */
public interface SmsSender {

    /**
     * @throws personal.clinic.booking.notification.domain.exception.NotificationDeliveryException 발송 실패 시
     */
    void send(String to, String text);
}
