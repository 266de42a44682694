package personal.clinic.booking.appointment.adapter.out.event;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.clinic.booking.appointment.application.port.out.AppointmentNotificationPort;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.notification.application.port.in.EnqueueNotificationUseCase;
import personal.clinic.booking.notification.domain.model.NotificationType;

/**
 * 예약 변경을 알림 작업(Outbox)으로 변환
 */
@Component
@RequiredArgsConstructor
public class AppointmentNotificationAdapter implements AppointmentNotificationPort {

    private final EnqueueNotificationUseCase enqueueNotificationUseCase;

    @Override
    public void bookingCreated(Appointment appointment) {
        enqueueNotificationUseCase.enqueue(NotificationType.BOOKING_PENDING, appointment, null);
    }

    @Override
    public void statusChanged(Appointment appointment) {
        enqueueNotificationUseCase.enqueue(NotificationType.STATUS_CHANGED, appointment, null);
    }

    @Override
    public void rescheduled(Appointment appointment, String reason) {
        enqueueNotificationUseCase.enqueue(NotificationType.APPOINTMENT_RESCHEDULED, appointment, reason);
    }
}
