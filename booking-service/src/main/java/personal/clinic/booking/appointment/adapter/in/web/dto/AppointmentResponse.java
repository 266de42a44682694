package personal.clinic.booking.appointment.adapter.in.web.dto;

import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;

import java.time.Instant;
import java.util.Map;

/**
 * 예약 조회 응답 DTO
 */
public record AppointmentResponse(
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
        Instant updatedAt
) {
    public static AppointmentResponse from(Appointment appointment) {
        return new AppointmentResponse(
                appointment.id(),
                appointment.providerId(),
                appointment.serviceId(),
                appointment.startTime(),
                appointment.endTime(),
                appointment.status(),
                appointment.patientName(),
                appointment.patientEmail(),
                appointment.patientPhone(),
                appointment.customFieldValues(),
                appointment.reminderSent(),
                appointment.reminderSentAt(),
                appointment.rescheduleReason(),
                appointment.createdAt(),
                appointment.updatedAt());
    }
}
