package personal.clinic.booking.notification.adapter.out.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import personal.clinic.booking.notification.application.port.out.EmailSender;
import personal.clinic.booking.notification.application.port.out.SmsSender;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Notification Gateway Configuration
 * external.*-gateway.base-url 이 비어 있으면 로그 발송기, 있으면 RestClient 게이트웨이 어댑터를 등록
 *
 * Timeout 전략:
 * - Connect Timeout (500ms): 게이트웨이 연결 실패 빠른 감지
 * - Read Timeout (3000ms): Circuit Breaker Slow Call 기준과 일치
 */
@Slf4j
@Configuration
public class NotificationGatewayConfig {

    @Bean
    public EmailSender emailSender(
            @Value("${external.email-gateway.base-url:}") String baseUrl,
            @Value("${external.email-gateway.api-key:}") String apiKey,
            @Value("${external.email-gateway.from:noreply@clinic.local}") String from,
            @Value("${external.email-gateway.connect-timeout-ms:500}") int connectTimeoutMs,
            @Value("${external.email-gateway.read-timeout-ms:3000}") int readTimeoutMs) {
        if (!StringUtils.hasText(baseUrl)) {
            log.info("Email gateway not configured, using logging sender");
            return new LoggingEmailSender();
        }
        log.info("Email gateway configured: baseUrl={}", baseUrl);
        return new EmailGatewayRestClientAdapter(
                gatewayRestClient(baseUrl, apiKey, connectTimeoutMs, readTimeoutMs), from);
    }

    @Bean
    public SmsSender smsSender(
            @Value("${external.sms-gateway.base-url:}") String baseUrl,
            @Value("${external.sms-gateway.api-key:}") String apiKey,
            @Value("${external.sms-gateway.from:}") String from,
            @Value("${external.sms-gateway.connect-timeout-ms:500}") int connectTimeoutMs,
            @Value("${external.sms-gateway.read-timeout-ms:3000}") int readTimeoutMs) {
        if (!StringUtils.hasText(baseUrl)) {
            log.info("SMS gateway not configured, using logging sender");
            return new LoggingSmsSender();
        }
        log.info("SMS gateway configured: baseUrl={}", baseUrl);
        return new SmsGatewayRestClientAdapter(
                gatewayRestClient(baseUrl, apiKey, connectTimeoutMs, readTimeoutMs), from);
    }

    static RestClient gatewayRestClient(String baseUrl, String apiKey, int connectTimeoutMs, int readTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory);
        if (StringUtils.hasText(apiKey)) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }
}
