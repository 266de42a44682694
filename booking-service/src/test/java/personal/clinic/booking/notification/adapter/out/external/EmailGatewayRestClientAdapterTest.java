package personal.clinic.booking.notification.adapter.out.external;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.HttpServerErrorException;
import personal.clinic.booking.notification.domain.exception.NotificationDeliveryException;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EmailGatewayRestClientAdapter 테스트 (WireMock)
 * Circuit Breaker 애너테이션은 Spring AOP 환경에서만 동작하므로 Registry로 직접 감싸 검증
 */
@WireMockTest
@DisplayName("Email Gateway Adapter 테스트 (WireMock)")
class EmailGatewayRestClientAdapterTest {

    private EmailGatewayRestClientAdapter adapter;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        adapter = new EmailGatewayRestClientAdapter(
                NotificationGatewayConfig.gatewayRestClient(wmRuntimeInfo.getHttpBaseUrl(), "test-key", 200, 1000),
                "noreply@clinic.test");

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(4)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(10))
                .ignoreExceptions(NotificationDeliveryException.class)
                .build();
        circuitBreaker = CircuitBreakerRegistry.of(config).circuitBreaker("emailGateway");
    }

    private void sendWithCircuitBreaker() {
        circuitBreaker.executeRunnable(() -> adapter.send("jane@example.com", "Subject", "Body"));
    }

    @Test
    @DisplayName("게이트웨이에 발신자, 수신자, 제목, 본문과 API 키를 전달한다")
    void postsMessage() {
        // given
        stubFor(post(urlEqualTo("/messages")).willReturn(aResponse().withStatus(202)));

        // when
        adapter.send("jane@example.com", "Appointment Pending Approval - Checkup", "Hello Jane");

        // then
        verify(postRequestedFor(urlEqualTo("/messages"))
                .withHeader("Authorization", equalTo("Bearer test-key"))
                .withRequestBody(matchingJsonPath("$.from", equalTo("noreply@clinic.test")))
                .withRequestBody(matchingJsonPath("$.to", equalTo("jane@example.com")))
                .withRequestBody(matchingJsonPath("$.subject", equalTo("Appointment Pending Approval - Checkup")))
                .withRequestBody(matchingJsonPath("$.text", equalTo("Hello Jane"))));
    }

    @Test
    @DisplayName("4xx 응답은 NotificationDeliveryException이며 Circuit 실패로 세지 않는다")
    void clientErrorDoesNotOpenCircuit() {
        // given
        stubFor(post(urlEqualTo("/messages")).willReturn(aResponse().withStatus(400)));

        // when & then
        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(this::sendWithCircuitBreaker)
                    .isInstanceOf(NotificationDeliveryException.class)
                    .hasMessageContaining("400");
        }
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("5xx 응답이 반복되면 Circuit이 열리고 이후 요청은 게이트웨이에 가지 않는다")
    void serverErrorsOpenCircuit() {
        // given
        stubFor(post(urlEqualTo("/messages")).willReturn(aResponse().withStatus(503)));

        // when
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(this::sendWithCircuitBreaker).isInstanceOf(HttpServerErrorException.class);
        }

        // then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(this::sendWithCircuitBreaker).isInstanceOf(CallNotPermittedException.class);
        verify(2, postRequestedFor(urlEqualTo("/messages")));
    }
}
