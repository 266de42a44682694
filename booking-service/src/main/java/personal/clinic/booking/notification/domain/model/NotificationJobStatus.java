package personal.clinic.booking.notification.domain.model;

/**
 * 알림 작업(Outbox) 상태
 */
public enum NotificationJobStatus {
    PENDING,    // 처리 대기
    DONE,       // 처리 완료 (채널별 발송 결과는 NotificationLog에 기록)
    FAILED      // 작업 자체를 처리할 수 없음 (재시도하지 않음)
}
