package personal.clinic.booking.catalog.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.clinic.booking.catalog.application.port.out.ProviderRepository;
import personal.clinic.booking.catalog.domain.model.Provider;
import personal.clinic.booking.store.EntityIds;

import java.util.List;
import java.util.Optional;

/**
 * Provider Persistence Adapter
 * JPA를 사용한 의료진 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderPersistenceAdapter implements ProviderRepository {

    private final JpaProviderRepository jpaProviderRepository;

    @Override
    public Provider save(Provider provider) {
        log.debug("Saving provider: providerId={}, name={}", provider.id(), provider.name());
        return jpaProviderRepository.save(ProviderEntity.fromDomain(provider)).toDomain();
    }

    @Override
    public Optional<Provider> findById(String providerId) {
        return EntityIds.findWithFallback(providerId, jpaProviderRepository::findById)
                .map(ProviderEntity::toDomain);
    }

    @Override
    public List<Provider> findAll() {
        return jpaProviderRepository.findAll(Sort.by("name")).stream()
                .map(ProviderEntity::toDomain)
                .toList();
    }

    @Override
    public List<Provider> findByServiceId(String serviceId) {
        return jpaProviderRepository.findByServiceId(serviceId).stream()
                .map(ProviderEntity::toDomain)
                .toList();
    }

    @Override
    public boolean deleteById(String providerId) {
        return EntityIds.findWithFallback(providerId, jpaProviderRepository::findById)
                .map(entity -> {
                    jpaProviderRepository.delete(entity);
                    return true;
                })
                .orElse(false);
    }

    @Override
    public Optional<Provider> lockForBooking(String providerId) {
        log.debug("Locking provider row: providerId={}", providerId);
        return EntityIds.findWithFallback(providerId, jpaProviderRepository::findByIdForUpdate)
                .map(ProviderEntity::toDomain);
    }
}
