package personal.clinic.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Booking Service Application
 * 예약 가능 시간 조회, 예약, 리마인더, 알림 발송을 담당하는 클리닉 예약 서비스
 */
@EnableScheduling  // Reminder Sweep, Notification Outbox Scheduler 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.clinic.booking",
        "personal.clinic.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class BookingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingServiceApplication.class, args);
    }
}
