package personal.clinic.booking.notification.application.port.in;

public record ReminderStats(long total, long sent, long failed) {
}
