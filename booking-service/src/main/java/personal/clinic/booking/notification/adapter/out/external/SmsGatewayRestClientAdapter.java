package personal.clinic.booking.notification.adapter.out.external;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import personal.clinic.booking.notification.application.port.out.SmsSender;
import personal.clinic.booking.notification.domain.exception.NotificationDeliveryException;
import personal.clinic.booking.notification.domain.model.NotificationChannel;

import java.util.Map;

/**
 * SMS Gateway REST Client Adapter
 */
@Slf4j
@RequiredArgsConstructor
public class SmsGatewayRestClientAdapter implements SmsSender {

    private final RestClient smsGatewayRestClient;
    private final String from;

    @Override
    @CircuitBreaker(name = "smsGateway", fallbackMethod = "sendFallback")
    @Bulkhead(name = "smsGateway", fallbackMethod = "sendFallback", type = Bulkhead.Type.SEMAPHORE)
    public void send(String to, String text) {
        smsGatewayRestClient.post()
                .uri("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("from", from, "to", to, "body", text))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, response) -> {
                    log.warn("SMS gateway rejected message: status={}", response.getStatusCode());
                    throw new NotificationDeliveryException(NotificationChannel.SMS,
                            "gateway rejected message with status " + response.getStatusCode().value());
                })
                .toBodilessEntity();
    }

    private void sendFallback(String to, String text, Exception e) {
        if (e instanceof NotificationDeliveryException deliveryException) {
            throw deliveryException;
        }
        log.error("SMS gateway unavailable: error={}", e.getClass().getSimpleName(), e);
        throw new NotificationDeliveryException(NotificationChannel.SMS, e.getClass().getSimpleName(), e);
    }
}
