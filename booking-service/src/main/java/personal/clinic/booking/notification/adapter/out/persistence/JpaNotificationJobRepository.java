package personal.clinic.booking.notification.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import personal.clinic.booking.notification.domain.model.NotificationJobStatus;

import java.util.List;

public interface JpaNotificationJobRepository extends JpaRepository<NotificationJobEntity, Long> {

    List<NotificationJobEntity> findByStatusOrderByCreatedAtAscIdAsc(NotificationJobStatus status, Pageable pageable);
}
