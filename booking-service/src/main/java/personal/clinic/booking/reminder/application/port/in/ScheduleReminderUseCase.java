package personal.clinic.booking.reminder.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;

/**
 * Schedule Reminder UseCase (Input Port)
 * 예약별 1회성 리마인더 타이머 등록/해제
 */
public interface ScheduleReminderUseCase {

    /**
     * 발송 시각(start - lead hours)이 미래이고 아직 발송 전인 활성 예약만 등록
     * 같은 예약의 기존 타이머는 교체된다.
     *
     * @return 타이머를 등록했으면 true
     */
    boolean schedule(Appointment appointment);

    void cancel(String appointmentId);
}
