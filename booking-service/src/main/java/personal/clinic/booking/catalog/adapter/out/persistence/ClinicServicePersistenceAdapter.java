package personal.clinic.booking.catalog.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.clinic.booking.catalog.application.port.out.ClinicServiceRepository;
import personal.clinic.booking.catalog.domain.model.ClinicService;
import personal.clinic.booking.store.EntityIds;

import java.util.List;
import java.util.Optional;

/**
 * Clinic Service Persistence Adapter
 * JPA를 사용한 진료 서비스 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClinicServicePersistenceAdapter implements ClinicServiceRepository {

    private final JpaClinicServiceRepository jpaClinicServiceRepository;

    @Override
    public ClinicService save(ClinicService service) {
        log.debug("Saving service: serviceId={}, name={}", service.id(), service.name());
        return jpaClinicServiceRepository.save(ClinicServiceEntity.fromDomain(service)).toDomain();
    }

    @Override
    public Optional<ClinicService> findById(String serviceId) {
        return EntityIds.findWithFallback(serviceId, jpaClinicServiceRepository::findById)
                .map(ClinicServiceEntity::toDomain);
    }

    @Override
    public List<ClinicService> findAll() {
        return jpaClinicServiceRepository.findAll(Sort.by("name")).stream()
                .map(ClinicServiceEntity::toDomain)
                .toList();
    }

    @Override
    public boolean deleteById(String serviceId) {
        return EntityIds.findWithFallback(serviceId, jpaClinicServiceRepository::findById)
                .map(entity -> {
                    jpaClinicServiceRepository.delete(entity);
                    return true;
                })
                .orElse(false);
    }
}
