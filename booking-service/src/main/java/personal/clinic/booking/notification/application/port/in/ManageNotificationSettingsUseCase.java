package personal.clinic.booking.notification.application.port.in;

import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.notification.domain.model.NotificationSettings;

/**
 * Manage Notification Settings UseCase (Input Port)
 */
public interface ManageNotificationSettingsUseCase {

    /**
     * 저장된 설정, 없으면 clinic.notification.* 기본값
     */
    NotificationSettings getSettings();

    NotificationSettings updateSettings(UpdateNotificationSettingsCommand command, StaffActor actor);

    NotificationSettings resetSettings(StaffActor actor);
}
