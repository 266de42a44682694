package personal.clinic.booking.notification.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import personal.clinic.booking.notification.domain.model.DeliveryStatus;
import personal.clinic.booking.notification.domain.model.NotificationType;

import java.util.List;

public interface JpaNotificationLogRepository extends JpaRepository<NotificationLogEntity, Long> {

    List<NotificationLogEntity> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    List<NotificationLogEntity> findByAppointmentIdOrderByCreatedAtDescIdDesc(String appointmentId, Pageable pageable);

    long countByType(NotificationType type);

    long countByTypeAndStatus(NotificationType type, DeliveryStatus status);
}
