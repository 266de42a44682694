package personal.clinic.booking.notification.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Notification Job Domain Model
 * 예약 트랜잭션 안에서 저장되고 백그라운드 작업자가 처리하는 알림 작업 (불변)
 *
 * @param payload NotificationPayload JSON
 */
public record NotificationJob(
        Long id,
        String appointmentId,
        NotificationType type,
        String payload,
        NotificationJobStatus status,
        String errorMessage,
        Instant createdAt,
        Instant processedAt) {

    public NotificationJob {
        if (appointmentId == null || appointmentId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment ID cannot be blank");
        }
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification type cannot be null");
        }
        if (payload == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification payload cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification job status cannot be null");
        }
    }

    public static NotificationJob create(String appointmentId, NotificationType type, String payload, Instant now) {
        return new NotificationJob(null, appointmentId, type, payload, NotificationJobStatus.PENDING, null, now, null);
    }

    public NotificationJob markDone(Instant now) {
        return new NotificationJob(id, appointmentId, type, payload, NotificationJobStatus.DONE, null, createdAt, now);
    }

    public NotificationJob markFailed(String error, Instant now) {
        return new NotificationJob(id, appointmentId, type, payload, NotificationJobStatus.FAILED, error,
                createdAt, now);
    }
}
