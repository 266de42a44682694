package personal.clinic.booking.notification.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.audit.application.port.in.RecordAuditUseCase;
import personal.clinic.booking.audit.domain.model.AuditChanges;
import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.config.ClinicProperties;
import personal.clinic.booking.notification.application.port.in.ManageNotificationSettingsUseCase;
import personal.clinic.booking.notification.application.port.in.UpdateNotificationSettingsCommand;
import personal.clinic.booking.notification.application.port.out.NotificationSettingsRepository;
import personal.clinic.booking.notification.domain.model.NotificationSettings;
import personal.clinic.common.exception.BusinessException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification Settings Service
 * 저장된 레코드가 없으면 clinic.notification.* 기본값을 사용
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationSettingsService implements ManageNotificationSettingsUseCase {

    static final String SETTINGS_ENTITY_ID = "notifications";

    private final NotificationSettingsRepository notificationSettingsRepository;
    private final RecordAuditUseCase recordAuditUseCase;
    private final ClinicProperties clinicProperties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public NotificationSettings getSettings() {
        return notificationSettingsRepository.find().orElseGet(this::defaults);
    }

    @Override
    @Transactional
    public NotificationSettings updateSettings(UpdateNotificationSettingsCommand command, StaffActor actor) {
        try {
            NotificationSettings current = getSettings();
            NotificationSettings updated = new NotificationSettings(
                    valueOr(command.notificationsEnabled(), current.notificationsEnabled()),
                    valueOr(command.emailNotificationsEnabled(), current.emailNotificationsEnabled()),
                    valueOr(command.smsNotificationsEnabled(), current.smsNotificationsEnabled()),
                    command.reminderHoursBefore() != null
                            ? command.reminderHoursBefore() : current.reminderHoursBefore(),
                    valueOr(command.bookingApprovalRequired(), current.bookingApprovalRequired()),
                    Instant.now(clock));
            NotificationSettings saved = notificationSettingsRepository.save(updated);

            recordAuditUseCase.record(AuditLog.success(actor, "update", AuditEntityType.SETTINGS,
                    SETTINGS_ENTITY_ID, "Notification Settings",
                    AuditChanges.detect(snapshot(current), snapshot(saved)), saved.updatedAt()));
            log.info("Notification settings updated: enabled={}, email={}, sms={}, reminderHoursBefore={}",
                    saved.notificationsEnabled(), saved.emailNotificationsEnabled(),
                    saved.smsNotificationsEnabled(), saved.reminderHoursBefore());
            return saved;
        } catch (BusinessException e) {
            recordFailure(actor, "update", e);
            throw e;
        }
    }

    @Override
    @Transactional
    public NotificationSettings resetSettings(StaffActor actor) {
        NotificationSettings current = getSettings();
        notificationSettingsRepository.delete();
        NotificationSettings defaults = defaults();

        recordAuditUseCase.record(AuditLog.success(actor, "reset", AuditEntityType.SETTINGS,
                SETTINGS_ENTITY_ID, "Notification Settings",
                AuditChanges.detect(snapshot(current), snapshot(defaults)), Instant.now(clock)));
        log.info("Notification settings reset to defaults");
        return defaults;
    }

    private NotificationSettings defaults() {
        ClinicProperties.Notification props = clinicProperties.notification();
        return new NotificationSettings(
                props.notificationsEnabled(),
                props.emailNotificationsEnabled(),
                props.smsNotificationsEnabled(),
                props.reminderHoursBefore(),
                props.bookingApprovalRequired(),
                null);
    }

    private void recordFailure(StaffActor actor, String action, BusinessException e) {
        log.warn("Notification settings operation failed: action={}, reason={}", action, e.getMessage());
        recordAuditUseCase.recordFailure(AuditLog.failure(actor, action, AuditEntityType.SETTINGS,
                SETTINGS_ENTITY_ID, e.getMessage(), Instant.now(clock)));
    }

    private static boolean valueOr(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }

    private static Map<String, Object> snapshot(NotificationSettings settings) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("notificationsEnabled", settings.notificationsEnabled());
        values.put("emailNotificationsEnabled", settings.emailNotificationsEnabled());
        values.put("smsNotificationsEnabled", settings.smsNotificationsEnabled());
        values.put("reminderHoursBefore", settings.reminderHoursBefore());
        values.put("bookingApprovalRequired", settings.bookingApprovalRequired());
        return values;
    }
}
