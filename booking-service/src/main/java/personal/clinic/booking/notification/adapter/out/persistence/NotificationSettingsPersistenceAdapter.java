package personal.clinic.booking.notification.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.clinic.booking.notification.application.port.out.NotificationSettingsRepository;
import personal.clinic.booking.notification.domain.model.NotificationSettings;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class NotificationSettingsPersistenceAdapter implements NotificationSettingsRepository {

    private final JpaNotificationSettingsRepository jpaNotificationSettingsRepository;

    @Override
    public Optional<NotificationSettings> find() {
        return jpaNotificationSettingsRepository.findById(NotificationSettingsEntity.SINGLETON_ID)
                .map(NotificationSettingsEntity::toDomain);
    }

    @Override
    public NotificationSettings save(NotificationSettings settings) {
        return jpaNotificationSettingsRepository.save(NotificationSettingsEntity.fromDomain(settings)).toDomain();
    }

    @Override
    public void delete() {
        if (jpaNotificationSettingsRepository.existsById(NotificationSettingsEntity.SINGLETON_ID)) {
            jpaNotificationSettingsRepository.deleteById(NotificationSettingsEntity.SINGLETON_ID);
        }
    }
}
