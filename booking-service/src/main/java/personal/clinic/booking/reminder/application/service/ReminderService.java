package personal.clinic.booking.reminder.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.booking.appointment.application.port.out.AppointmentRepository;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.config.ClinicProperties;
import personal.clinic.booking.notification.application.port.in.DispatchNotificationUseCase;
import personal.clinic.booking.notification.application.port.in.ManageNotificationSettingsUseCase;
import personal.clinic.booking.notification.domain.model.DispatchResult;
import personal.clinic.booking.notification.domain.model.NotificationType;
import personal.clinic.booking.reminder.application.port.in.GetReminderStatusUseCase;
import personal.clinic.booking.reminder.application.port.in.ReminderSchedulerStatus;
import personal.clinic.booking.reminder.application.port.in.RunReminderSweepUseCase;
import personal.clinic.booking.reminder.application.port.in.ScheduleReminderUseCase;
import personal.clinic.booking.reminder.application.port.out.ReminderTimerPort;
import personal.clinic.booking.store.StoreQuery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reminder Service
 * <ul>
 *     <li>타이머: 예약 시작 lead-hours 전 1회 발송</li>
 *     <li>주기 점검: reminderHoursBefore 범위 안의 미발송 예약 즉시 발송</li>
 * </ul>
 * 타이머와 주기 점검이 겹쳐도 claimReminder 선점에 성공한 쪽만 발송한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderService implements ScheduleReminderUseCase, RunReminderSweepUseCase, GetReminderStatusUseCase {

    private final AppointmentRepository appointmentRepository;
    private final DispatchNotificationUseCase dispatchNotificationUseCase;
    private final ManageNotificationSettingsUseCase manageNotificationSettingsUseCase;
    private final ReminderTimerPort reminderTimerPort;
    private final ClinicProperties clinicProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicReference<Instant> lastSweepAt = new AtomicReference<>();

    @Override
    public boolean schedule(Appointment appointment) {
        reminderTimerPort.cancelAll(appointment.id());
        if (!appointment.isActive() || appointment.reminderSent()) {
            return false;
        }

        Instant fireAt = appointment.startTime()
                .minus(Duration.ofHours(clinicProperties.reminder().timerLeadHours()));
        if (!fireAt.isAfter(Instant.now(clock))) {
            // 이미 지난 시각: 주기 점검이 처리
            return false;
        }

        String appointmentId = appointment.id();
        reminderTimerPort.arm(appointmentId, fireAt, () -> fireSafely(appointmentId));
        return true;
    }

    @Override
    public void cancel(String appointmentId) {
        reminderTimerPort.cancelAll(appointmentId);
    }

    @Override
    public int reconcile() {
        Instant now = Instant.now(clock);
        List<Appointment> upcoming = appointmentRepository.findAll(pendingReminders(now,
                now.plus(Duration.ofDays(clinicProperties.reminder().reconciliationWindowDays()))));

        int armed = 0;
        for (Appointment appointment : upcoming) {
            if (schedule(appointment)) {
                armed++;
            }
        }
        log.info("Reminder timers reconciled: candidates={}, armed={}", upcoming.size(), armed);
        return armed;
    }

    @Override
    public int sweep() {
        Instant now = Instant.now(clock);
        int hoursBefore = manageNotificationSettingsUseCase.getSettings().reminderHoursBefore();
        List<Appointment> due = appointmentRepository.findAll(
                pendingReminders(now, now.plus(Duration.ofHours(hoursBefore))));

        int fired = 0;
        for (Appointment appointment : due) {
            if (fireSafely(appointment.id())) {
                fired++;
            }
        }
        lastSweepAt.set(now);
        if (fired > 0) {
            log.info("Reminder sweep completed: candidates={}, fired={}", due.size(), fired);
        }
        return fired;
    }

    @Override
    public boolean fire(String appointmentId) {
        Appointment appointment = appointmentRepository.findById(appointmentId).orElse(null);
        if (appointment == null || !appointment.isActive() || appointment.reminderSent()) {
            log.debug("Reminder skipped: appointmentId={}", appointmentId);
            return false;
        }

        if (!appointmentRepository.claimReminder(appointment.id(), Instant.now(clock))) {
            log.debug("Reminder already claimed: appointmentId={}", appointmentId);
            counter("claimed_elsewhere").increment();
            return false;
        }

        DispatchResult result = dispatchNotificationUseCase.dispatch(NotificationType.APPOINTMENT_REMINDER,
                appointment);
        counter(result.failed() > 0 ? "failed" : "sent").increment();
        log.info("Reminder fired: appointmentId={}, start={}, sent={}, failed={}",
                appointment.id(), appointment.startTime(), result.sent(), result.failed());
        reminderTimerPort.cancelAll(appointment.id());
        return true;
    }

    @Override
    public ReminderSchedulerStatus getStatus() {
        return new ReminderSchedulerStatus(reminderTimerPort.armedCount(), lastSweepAt.get());
    }

    private boolean fireSafely(String appointmentId) {
        try {
            return fire(appointmentId);
        } catch (RuntimeException e) {
            log.error("Reminder failed: appointmentId={}", appointmentId, e);
            counter("error").increment();
            return false;
        }
    }

    private StoreQuery pendingReminders(Instant from, Instant to) {
        return StoreQuery.where()
                .in("status", AppointmentStatus.ACTIVE)
                .eq("reminderSent", false)
                .gte("startTime", from)
                .lte("startTime", to)
                .orderByAsc("startTime")
                .build();
    }

    private Counter counter(String outcome) {
        return Counter.builder("clinic.reminders")
                .tag("outcome", outcome)
                .description("Reminder attempts by outcome")
                .register(meterRegistry);
    }
}
