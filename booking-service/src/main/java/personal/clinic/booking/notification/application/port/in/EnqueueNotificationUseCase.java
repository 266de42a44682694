package personal.clinic.booking.notification.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.notification.domain.model.NotificationType;

/**
 * Enqueue Notification UseCase (Input Port)
 * 호출자의 트랜잭션 안에서 알림 작업을 저장하고 즉시 반환
 */
public interface EnqueueNotificationUseCase {

    /**
     * @param rescheduleReason APPOINTMENT_RESCHEDULED 외에는 null
     */
    void enqueue(NotificationType type, Appointment appointment, String rescheduleReason);
}
