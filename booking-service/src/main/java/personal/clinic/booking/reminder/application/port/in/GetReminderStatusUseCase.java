package personal.clinic.booking.reminder.application.port.in;

public interface GetReminderStatusUseCase {

    ReminderSchedulerStatus getStatus();
}
