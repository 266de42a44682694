package personal.clinic.booking.notification.adapter.out.external;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import personal.clinic.booking.notification.application.port.out.EmailSender;
import personal.clinic.booking.notification.domain.exception.NotificationDeliveryException;
import personal.clinic.booking.notification.domain.model.NotificationChannel;

import java.util.Map;

/**
 * Email Gateway REST Client Adapter
 * 외부 메일 게이트웨이(POST /messages)로 텍스트 메일 발송
 * <ul>
 *     <li>4xx: NotificationDeliveryException (Circuit 실패로 세지 않음)</li>
 *     <li>5xx, Timeout: Circuit 실패로 카운트</li>
 * </ul>
 * 재시도하지 않는다. 실패는 호출자가 FAILED 로그로 남긴다.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailGatewayRestClientAdapter implements EmailSender {

    private final RestClient emailGatewayRestClient;
    private final String from;

    @Override
    @CircuitBreaker(name = "emailGateway", fallbackMethod = "sendFallback")
    @Bulkhead(name = "emailGateway", fallbackMethod = "sendFallback", type = Bulkhead.Type.SEMAPHORE)
    public void send(String to, String subject, String body) {
        log.debug("Sending email: subject={}", subject);

        Map<String, Object> requestBody = Map.of(
                "from", from,
                "to", to,
                "subject", subject,
                "text", body);

        emailGatewayRestClient.post()
                .uri("/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, response) -> {
                    log.warn("Email gateway rejected message: status={}", response.getStatusCode());
                    throw new NotificationDeliveryException(NotificationChannel.EMAIL,
                            "gateway rejected message with status " + response.getStatusCode().value());
                })
                .toBodilessEntity();
    }

    /**
     * Circuit Open, Bulkhead Full, 5xx, Timeout 시 호출
     */
    private void sendFallback(String to, String subject, String body, Exception e) {
        if (e instanceof NotificationDeliveryException deliveryException) {
            throw deliveryException;
        }
        log.error("Email gateway unavailable: error={}", e.getClass().getSimpleName(), e);
        throw new NotificationDeliveryException(NotificationChannel.EMAIL, e.getClass().getSimpleName(), e);
    }
}
