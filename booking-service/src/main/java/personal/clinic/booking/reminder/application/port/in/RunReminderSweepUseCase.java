package personal.clinic.booking.reminder.application.port.in;

/**
 * Run Reminder Sweep UseCase (Input Port)
 */
public interface RunReminderSweepUseCase {

    /**
     * 기동 시 향후 예약에 대해 타이머 재등록
     *
     * @return 등록한 타이머 수
     */
    int reconcile();

    /**
     * 리마인더 조회 범위 안에 시작하는 미발송 예약에 즉시 발송
     *
     * @return 발송 권한을 선점해 발송한 예약 수
     */
    int sweep();

    /**
     * 예약 1건에 리마인더 발송 (이미 발송되었으면 무시)
     *
     * @return 이번 호출에서 발송했으면 true
     */
    boolean fire(String appointmentId);
}
