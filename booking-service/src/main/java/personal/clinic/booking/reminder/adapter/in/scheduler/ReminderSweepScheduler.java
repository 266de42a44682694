package personal.clinic.booking.reminder.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.clinic.booking.reminder.application.port.in.RunReminderSweepUseCase;

/**
 * Reminder Sweep Scheduler (Driving Adapter)
 * 주기: clinic.reminder.sweep-interval-ms (기본 60초)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderSweepScheduler {

    private final RunReminderSweepUseCase runReminderSweepUseCase;

    @Scheduled(fixedDelayString = "${clinic.reminder.sweep-interval-ms:60000}",
            initialDelayString = "${clinic.reminder.sweep-initial-delay-ms:10000}")
    public void sweep() {
        try {
            int fired = runReminderSweepUseCase.sweep();
            log.debug("Reminder sweep finished. Fired: {}", fired);
        } catch (RuntimeException e) {
            log.error("Reminder sweep failed", e);
        }
    }
}
