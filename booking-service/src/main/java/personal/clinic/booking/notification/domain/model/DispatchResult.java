package personal.clinic.booking.notification.domain.model;

/**
 * 알림 1건의 채널별 발송 집계
 */
public record DispatchResult(int sent, int failed) {

    public static final DispatchResult NONE = new DispatchResult(0, 0);

    public boolean attempted() {
        return sent + failed > 0;
    }
}
