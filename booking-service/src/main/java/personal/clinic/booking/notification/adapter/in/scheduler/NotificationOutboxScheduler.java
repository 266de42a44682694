package personal.clinic.booking.notification.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.clinic.booking.notification.application.port.in.ProcessNotificationJobsUseCase;

/**
 * Notification Outbox Scheduler (Driving Adapter)
 * 주기적으로 PENDING 알림 작업을 처리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationOutboxScheduler {

    private final ProcessNotificationJobsUseCase processNotificationJobsUseCase;

    /**
     * 이전 실행 완료 후 poll-interval-ms 마다 실행
     */
    @Scheduled(fixedDelayString = "${clinic.notification.poll-interval-ms:1000}",
            initialDelayString = "${clinic.notification.poll-initial-delay-ms:1000}")
    public void processPendingJobs() {
        try {
            int processedCount = processNotificationJobsUseCase.processPendingJobs();
            if (processedCount > 0) {
                log.debug("Notification outbox processed. Count: {}", processedCount);
            }
        } catch (RuntimeException e) {
            log.error("Notification outbox poll failed", e);
        }
    }
}
