package personal.clinic.booking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * 시간/난수 소스 설정
 * 테스트에서 고정 Clock과 시드 Random으로 교체할 수 있도록 Bean으로 노출
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 슬롯 샘플링용 난수 소스
     */
    @Bean
    public Random slotRandom() {
        return new SecureRandom();
    }
}
