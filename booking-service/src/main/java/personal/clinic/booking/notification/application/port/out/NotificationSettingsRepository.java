package personal.clinic.booking.notification.application.port.out;

import personal.clinic.booking.notification.domain.model.NotificationSettings;

import java.util.Optional;

/**
 * Notification Settings Repository (Output Port)
 * 설정은 단일 레코드로 관리
 */
public interface NotificationSettingsRepository {

    Optional<NotificationSettings> find();

    NotificationSettings save(NotificationSettings settings);

    void delete();
}
