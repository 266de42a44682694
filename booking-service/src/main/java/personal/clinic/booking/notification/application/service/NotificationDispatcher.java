package personal.clinic.booking.notification.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.notification.application.port.in.DispatchNotificationUseCase;
import personal.clinic.booking.notification.application.port.in.ManageNotificationSettingsUseCase;
import personal.clinic.booking.notification.application.port.out.EmailSender;
import personal.clinic.booking.notification.application.port.out.NotificationLogRepository;
import personal.clinic.booking.notification.application.port.out.SmsSender;
import personal.clinic.booking.notification.domain.exception.NotificationDeliveryException;
import personal.clinic.booking.notification.domain.model.DispatchResult;
import personal.clinic.booking.notification.domain.model.NotificationChannel;
import personal.clinic.booking.notification.domain.model.NotificationLog;
import personal.clinic.booking.notification.domain.model.NotificationPayload;
import personal.clinic.booking.notification.domain.model.NotificationSettings;
import personal.clinic.booking.notification.domain.model.NotificationTemplate;
import personal.clinic.booking.notification.domain.model.NotificationType;
import personal.clinic.booking.notification.domain.service.NotificationTemplates;
import personal.clinic.booking.notification.domain.service.TemplateRenderer;

import java.time.Clock;
import java.time.Instant;

/**
 * Notification Dispatcher
 * 채널별로 템플릿을 렌더링해 발송하고, 시도마다 NotificationLog를 남긴다.
 * 발송 실패는 호출자에게 전파하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher implements DispatchNotificationUseCase {

    private final ManageNotificationSettingsUseCase manageNotificationSettingsUseCase;
    private final NotificationVariablesFactory notificationVariablesFactory;
    private final NotificationLogRepository notificationLogRepository;
    private final EmailSender emailSender;
    private final SmsSender smsSender;
    private final Clock clock;

    @Override
    public DispatchResult dispatch(NotificationType type, Appointment appointment) {
        return deliver(appointment.id(), type, notificationVariablesFactory.create(appointment, null));
    }

    @Override
    public DispatchResult deliver(String appointmentId, NotificationType type, NotificationPayload payload) {
        NotificationSettings settings = manageNotificationSettingsUseCase.getSettings();
        if (!settings.notificationsEnabled()) {
            log.debug("Notifications disabled, skipping: type={}, appointmentId={}", type, appointmentId);
            return DispatchResult.NONE;
        }

        NotificationTemplate template = NotificationTemplates.of(type);
        int sent = 0;
        int failed = 0;

        if (settings.isEnabled(NotificationChannel.EMAIL) && hasText(payload.recipientEmail())) {
            boolean ok = attempt(appointmentId, type, NotificationChannel.EMAIL, payload, () -> emailSender.send(
                    payload.recipientEmail(),
                    TemplateRenderer.render(template.emailSubject(), payload.variables()),
                    TemplateRenderer.render(template.emailBody(), payload.variables())));
            if (ok) {
                sent++;
            } else {
                failed++;
            }
        }

        if (settings.isEnabled(NotificationChannel.SMS) && hasText(payload.recipientPhone())) {
            boolean ok = attempt(appointmentId, type, NotificationChannel.SMS, payload, () -> smsSender.send(
                    payload.recipientPhone(),
                    TemplateRenderer.render(template.smsText(), payload.variables())));
            if (ok) {
                sent++;
            } else {
                failed++;
            }
        }

        log.info("Notification dispatched: type={}, appointmentId={}, sent={}, failed={}",
                type, appointmentId, sent, failed);
        return new DispatchResult(sent, failed);
    }

    private boolean attempt(String appointmentId, NotificationType type, NotificationChannel channel,
                            NotificationPayload payload, Runnable send) {
        try {
            send.run();
            notificationLogRepository.save(NotificationLog.sent(appointmentId, type, channel, payload,
                    Instant.now(clock)));
            return true;
        } catch (NotificationDeliveryException e) {
            log.warn("Notification delivery failed: type={}, channel={}, appointmentId={}, reason={}",
                    type, channel, appointmentId, e.getMessage());
            notificationLogRepository.save(NotificationLog.failed(appointmentId, type, channel, payload,
                    e.getMessage(), Instant.now(clock)));
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected notification failure: type={}, channel={}, appointmentId={}",
                    type, channel, appointmentId, e);
            notificationLogRepository.save(NotificationLog.failed(appointmentId, type, channel, payload,
                    e.getMessage(), Instant.now(clock)));
            return false;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
