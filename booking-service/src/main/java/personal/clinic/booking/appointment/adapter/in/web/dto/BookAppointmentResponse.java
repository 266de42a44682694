package personal.clinic.booking.appointment.adapter.in.web.dto;

public record BookAppointmentResponse(
        boolean success,
        String appointmentId,
        String message
) {
    private static final String BOOKED_MESSAGE =
            "Appointment booked successfully. You will receive a confirmation email shortly.";

    public static BookAppointmentResponse booked(String appointmentId) {
        return new BookAppointmentResponse(true, appointmentId, BOOKED_MESSAGE);
    }
}
