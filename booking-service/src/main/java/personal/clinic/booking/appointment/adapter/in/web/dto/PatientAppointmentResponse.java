package personal.clinic.booking.appointment.adapter.in.web.dto;

import personal.clinic.booking.appointment.application.port.in.PatientAppointmentView;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;

import java.time.Instant;

/**
 * 환자 예약 이력 응답 DTO (서비스/의료진 이름 포함)
 */
public record PatientAppointmentResponse(
        String id,
        String providerId,
        String providerName,
        String serviceId,
        String serviceName,
        Instant startTime,
        Instant endTime,
        AppointmentStatus status,
        String patientName,
        String patientEmail,
        String rescheduleReason,
        Instant createdAt
) {
    public static PatientAppointmentResponse from(PatientAppointmentView view) {
        Appointment appointment = view.appointment();
        return new PatientAppointmentResponse(
                appointment.id(),
                appointment.providerId(),
                view.providerName(),
                appointment.serviceId(),
                view.serviceName(),
                appointment.startTime(),
                appointment.endTime(),
                appointment.status(),
                appointment.patientName(),
                appointment.patientEmail(),
                appointment.rescheduleReason(),
                appointment.createdAt());
    }
}
