package personal.clinic.booking.appointment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.appointment.application.port.out.AppointmentRepository;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.store.EntityIds;
import personal.clinic.booking.store.StoreQuery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Appointment Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentPersistenceAdapter implements AppointmentRepository {

    private final JpaAppointmentRepository jpaAppointmentRepository;

    @Override
    public Appointment save(Appointment appointment) {
        log.debug("Saving appointment: appointmentId={}, providerId={}, status={}",
                appointment.id(), appointment.providerId(), appointment.status());
        // Unique Index 위반을 트랜잭션 안에서 바로 감지하도록 즉시 flush
        return jpaAppointmentRepository.saveAndFlush(AppointmentEntity.fromDomain(appointment)).toDomain();
    }

    @Override
    public Optional<Appointment> findById(String appointmentId) {
        return EntityIds.findWithFallback(appointmentId, jpaAppointmentRepository::findById)
                .map(AppointmentEntity::toDomain);
    }

    @Override
    public List<Appointment> findAll(StoreQuery query) {
        log.debug("Finding appointments: conditions={}", query.conditions());
        if (query.isPaged()) {
            return jpaAppointmentRepository.findAll(query.<AppointmentEntity>toSpecification(), query.toPageable())
                    .map(AppointmentEntity::toDomain)
                    .getContent();
        }
        return jpaAppointmentRepository.findAll(query.<AppointmentEntity>toSpecification(), query.sort()).stream()
                .map(AppointmentEntity::toDomain)
                .toList();
    }

    @Override
    public long count(StoreQuery query) {
        return jpaAppointmentRepository.count(query.<AppointmentEntity>toSpecification());
    }

    @Override
    public long countDistinctPatients() {
        return jpaAppointmentRepository.countDistinctPatientEmails();
    }

    @Override
    @Transactional
    public boolean claimReminder(String appointmentId, Instant sentAt) {
        return jpaAppointmentRepository.claimReminder(appointmentId, sentAt) == 1;
    }
}
