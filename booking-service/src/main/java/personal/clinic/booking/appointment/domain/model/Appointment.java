package personal.clinic.booking.appointment.domain.model;

import personal.clinic.booking.appointment.domain.exception.InvalidStatusTransitionException;
import personal.clinic.booking.store.EntityIds;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Appointment Domain Model
 * 진료 예약 도메인 모델 (불변)
 */
public record Appointment(
        String id,
        String providerId,
        String serviceId,
        Instant startTime,
        Instant endTime,
        AppointmentStatus status,
        String patientName,
        String patientEmail,
        String patientPhone,
        Map<String, String> customFieldValues,
        boolean reminderSent,
        Instant reminderSentAt,
        String rescheduleReason,
        Instant createdAt,
        Instant updatedAt) {

    public Appointment {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, "Provider ID is required");
        }
        if (serviceId == null || serviceId.isBlank()) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, "Service ID is required");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment status cannot be null");
        }
        if (startTime == null || endTime == null || !startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Start time must be before end time: start=%s, end=%s", startTime, endTime));
        }
        customFieldValues = customFieldValues == null ? Map.of() : customFieldValues.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     * 새 예약은 항상 PENDING 상태, 이메일은 소문자로 정규화
     */
    public static Appointment create(String providerId, String serviceId, TimeInterval interval,
                                     String patientName, String patientEmail, String patientPhone,
                                     Map<String, String> customFieldValues, Instant now) {
        return new Appointment(
                EntityIds.newId(),
                providerId,
                serviceId,
                interval.start(),
                interval.end(),
                AppointmentStatus.PENDING,
                patientName.trim(),
                patientEmail.trim().toLowerCase(Locale.ROOT),
                patientPhone.trim(),
                customFieldValues,
                false,
                null,
                null,
                now,
                now);
    }

    public TimeInterval interval() {
        return new TimeInterval(startTime, endTime);
    }

    public boolean isActive() {
        return status.isActive();
    }

    /**
     * 상태 변경
     *
     * @throws InvalidStatusTransitionException 허용되지 않는 전환일 때
     */
    public Appointment changeStatus(AppointmentStatus newStatus, Instant now) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidStatusTransitionException(status, newStatus);
        }
        return new Appointment(id, providerId, serviceId, startTime, endTime, newStatus,
                patientName, patientEmail, patientPhone, customFieldValues,
                reminderSent, reminderSentAt, rescheduleReason, createdAt, now);
    }

    /**
     * 일정 변경 (상태는 유지, 리마인더 발송 여부는 초기화)
     *
     * @param reason null이면 기존 사유 유지
     */
    public Appointment reschedule(TimeInterval newInterval, String reason, Instant now) {
        if (!isActive()) {
            throw new InvalidStatusTransitionException(status, "reschedule");
        }
        String newReason = reason != null && !reason.isBlank() ? reason : rescheduleReason;
        return new Appointment(id, providerId, serviceId, newInterval.start(), newInterval.end(), status,
                patientName, patientEmail, patientPhone, customFieldValues,
                false, null, newReason, createdAt, now);
    }
}
