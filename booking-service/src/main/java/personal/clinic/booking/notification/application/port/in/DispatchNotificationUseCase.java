package personal.clinic.booking.notification.application.port.in;

import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.notification.domain.model.DispatchResult;
import personal.clinic.booking.notification.domain.model.NotificationPayload;
import personal.clinic.booking.notification.domain.model.NotificationType;

/**
 * Dispatch Notification UseCase (Input Port)
 * 설정에서 활성화된 채널로 즉시 발송하고 채널별 로그를 남긴다.
 * 발송 실패는 예외로 전파하지 않는다.
 */
public interface DispatchNotificationUseCase {

    DispatchResult dispatch(NotificationType type, Appointment appointment);

    DispatchResult deliver(String appointmentId, NotificationType type, NotificationPayload payload);
}
