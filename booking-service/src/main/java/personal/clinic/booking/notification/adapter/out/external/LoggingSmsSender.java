package personal.clinic.booking.notification.adapter.out.external;

import lombok.extern.slf4j.Slf4j;
import personal.clinic.booking.notification.application.port.out.SmsSender;

@Slf4j
public class LoggingSmsSender implements SmsSender {

    @Override
    public void send(String to, String text) {
        log.info("[SMS] to={}, text={}", to, text);
    }
}
