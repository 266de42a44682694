package personal.clinic.booking.notification.domain.model;

/**
 * 알림 종류
 */
public enum NotificationType {
    /**
     * 예약 접수 (승인 대기)
     */
    BOOKING_PENDING,

    /**
     * 예약 상태 변경
     */
    STATUS_CHANGED,

    /**
     * 일정 변경
     */
    APPOINTMENT_RESCHEDULED,

    /**
     * 방문 전 리마인더
     */
    APPOINTMENT_REMINDER
}
