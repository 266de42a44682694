package personal.clinic.booking.reminder.application.port.in;

import java.time.Instant;

/**
 * @param lastSweepAt 아직 점검 전이면 null
 */
public record ReminderSchedulerStatus(int armedTimers, Instant lastSweepAt) {
}
