package personal.clinic.booking.appointment.application.port.in;

public record AppointmentStats(
        long totalAppointments,
        long pendingAppointments,
        long confirmedAppointments,
        long totalPatients
) {
}
