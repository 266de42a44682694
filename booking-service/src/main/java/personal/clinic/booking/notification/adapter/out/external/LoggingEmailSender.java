package personal.clinic.booking.notification.adapter.out.external;

import lombok.extern.slf4j.Slf4j;
import personal.clinic.booking.notification.application.port.out.EmailSender;

/**
 * 게이트웨이 URL이 설정되지 않았을 때 사용하는 발송기 (로그만 남김)
 */
@Slf4j
public class LoggingEmailSender implements EmailSender {

    @Override
    public void send(String to, String subject, String body) {
        log.info("[EMAIL] to={}, subject={}", to, subject);
        log.debug("[EMAIL] body:\n{}", body);
    }
}
