package personal.clinic.booking.notification.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.clinic.booking.notification.application.port.out.NotificationLogRepository;
import personal.clinic.booking.notification.domain.model.DeliveryStatus;
import personal.clinic.booking.notification.domain.model.NotificationLog;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.util.List;

@Component
@RequiredArgsConstructor
public class NotificationLogPersistenceAdapter implements NotificationLogRepository {

    private final JpaNotificationLogRepository jpaNotificationLogRepository;

    @Override
    public NotificationLog save(NotificationLog log) {
        return jpaNotificationLogRepository.save(NotificationLogEntity.fromDomain(log)).toDomain();
    }

    @Override
    public List<NotificationLog> findRecent(String appointmentId, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<NotificationLogEntity> entities = appointmentId == null
                ? jpaNotificationLogRepository.findAllByOrderByCreatedAtDescIdDesc(page)
                : jpaNotificationLogRepository.findByAppointmentIdOrderByCreatedAtDescIdDesc(appointmentId, page);
        return entities.stream()
                .map(NotificationLogEntity::toDomain)
                .toList();
    }

    @Override
    public long countByType(NotificationType type) {
        return jpaNotificationLogRepository.countByType(type);
    }

    @Override
    public long countByTypeAndStatus(NotificationType type, DeliveryStatus status) {
        return jpaNotificationLogRepository.countByTypeAndStatus(type, status);
    }
}
