package personal.clinic.booking.notification.application.port.out;

/**
 * Email 발송 (Output Port)
 *
 * @throws personal.clinic.booking.notification.domain.exception.NotificationDeliveryException 발송 실패 시
 */
public interface EmailSender {

    void send(String to, String subject, String body);
}
