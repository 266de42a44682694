package personal.clinic.booking.reminder.application.port.out;

import java.time.Instant;

/**
 * 1회성 타이머 (Output Port)
 * 키는 (appointmentId, fireAt). 같은 키로 다시 등록하면 기존 타이머를 교체한다.
 */
public interface ReminderTimerPort {

    void arm(String appointmentId, Instant fireAt, Runnable task);

    /**
     * 예약에 걸린 모든 타이머 해제
     *
     * @return 해제한 타이머 수
     */
    int cancelAll(String appointmentId);

    int armedCount();
}
