package personal.clinic.booking.reminder.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import personal.clinic.booking.reminder.application.port.in.RunReminderSweepUseCase;

/**
 * 기동 완료 시 메모리 타이머 복구
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderStartupReconciler {

    private final RunReminderSweepUseCase runReminderSweepUseCase;

    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        try {
            runReminderSweepUseCase.reconcile();
        } catch (RuntimeException e) {
            log.error("Reminder reconciliation failed on startup", e);
        }
    }
}
