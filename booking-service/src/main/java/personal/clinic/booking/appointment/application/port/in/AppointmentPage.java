package personal.clinic.booking.appointment.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;

import java.util.List;

public record AppointmentPage(
        List<Appointment> appointments,
        long total,
        int limit,
        int skip
) {
}
