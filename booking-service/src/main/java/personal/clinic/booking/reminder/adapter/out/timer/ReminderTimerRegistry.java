package personal.clinic.booking.reminder.adapter.out.timer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import personal.clinic.booking.reminder.application.port.out.ReminderTimerPort;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reminder Timer Registry
 * TaskScheduler 위의 1회성 타이머를 메모리에 보관 (재기동 시 reconcile로 복구)
 * 예약 ID별로 발송 시각 -> 타이머를 묶어 보관한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderTimerRegistry implements ReminderTimerPort {

    private final TaskScheduler taskScheduler;
    private final Map<String, Map<Instant, ScheduledFuture<?>>> timers = new ConcurrentHashMap<>();

    @Override
    public void arm(String appointmentId, Instant fireAt, Runnable task) {
        ScheduledFuture<?> future = taskScheduler.schedule(() -> {
            release(appointmentId, fireAt);
            task.run();
        }, fireAt);

        AtomicReference<ScheduledFuture<?>> previous = new AtomicReference<>();
        timers.compute(appointmentId, (id, byFireTime) -> {
            Map<Instant, ScheduledFuture<?>> armed = byFireTime == null ? new ConcurrentHashMap<>() : byFireTime;
            previous.set(armed.put(fireAt, future));
            return armed;
        });
        if (previous.get() != null) {
            previous.get().cancel(false);
            log.debug("Reminder timer replaced: appointmentId={}, fireAt={}", appointmentId, fireAt);
        }
        log.debug("Reminder timer armed: appointmentId={}, fireAt={}", appointmentId, fireAt);
    }

    @Override
    public int cancelAll(String appointmentId) {
        Map<Instant, ScheduledFuture<?>> armed = timers.remove(appointmentId);
        if (armed == null || armed.isEmpty()) {
            return 0;
        }
        armed.values().forEach(future -> future.cancel(false));
        log.debug("Reminder timers cancelled: appointmentId={}, count={}", appointmentId, armed.size());
        return armed.size();
    }

    @Override
    public int armedCount() {
        return timers.values().stream().mapToInt(Map::size).sum();
    }

    private void release(String appointmentId, Instant fireAt) {
        timers.computeIfPresent(appointmentId, (id, armed) -> {
            armed.remove(fireAt);
            return armed.isEmpty() ? null : armed;
        });
    }
}
