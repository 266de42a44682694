package personal.clinic.booking.notification.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaNotificationSettingsRepository extends JpaRepository<NotificationSettingsEntity, Long> {
}
