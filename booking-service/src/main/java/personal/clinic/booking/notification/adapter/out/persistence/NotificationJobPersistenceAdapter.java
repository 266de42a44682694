package personal.clinic.booking.notification.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.clinic.booking.notification.application.port.out.NotificationJobRepository;
import personal.clinic.booking.notification.domain.model.NotificationJob;
import personal.clinic.booking.notification.domain.model.NotificationJobStatus;

import java.util.List;

@Component
@RequiredArgsConstructor
public class NotificationJobPersistenceAdapter implements NotificationJobRepository {

    private final JpaNotificationJobRepository jpaNotificationJobRepository;

    @Override
    public NotificationJob save(NotificationJob job) {
        return jpaNotificationJobRepository.save(NotificationJobEntity.fromDomain(job)).toDomain();
    }

    @Override
    public List<NotificationJob> findPending(int limit) {
        return jpaNotificationJobRepository.findByStatusOrderByCreatedAtAscIdAsc(
                        NotificationJobStatus.PENDING, PageRequest.of(0, limit)).stream()
                .map(NotificationJobEntity::toDomain)
                .toList();
    }
}
