package personal.clinic.booking.appointment.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.booking.appointment.application.port.out.ReminderSchedulingPort;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.reminder.application.port.in.ScheduleReminderUseCase;

/**
 * 리마인더 타이머 연동
 * 타이머 등록 실패는 예약 결과에 영향을 주지 않는다 (주기 점검이 보완).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderSchedulingAdapter implements ReminderSchedulingPort {

    private final ScheduleReminderUseCase scheduleReminderUseCase;

    @Override
    public void schedule(Appointment appointment) {
        try {
            scheduleReminderUseCase.schedule(appointment);
        } catch (RuntimeException e) {
            log.error("Failed to arm reminder timer: appointmentId={}", appointment.id(), e);
        }
    }

    @Override
    public void cancel(String appointmentId) {
        scheduleReminderUseCase.cancel(appointmentId);
    }
}
