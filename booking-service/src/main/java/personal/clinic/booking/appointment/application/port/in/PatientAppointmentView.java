package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;

public record PatientAppointmentView(
        Appointment appointment,
        String serviceName,
        String providerName
) {
}
