package personal.clinic.booking.catalog.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.catalog.application.port.out.ProviderAvailabilityRepository;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;
import personal.clinic.booking.store.EntityIds;

import java.util.Optional;

/**
 * Provider Availability Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderAvailabilityPersistenceAdapter implements ProviderAvailabilityRepository {

    private final JpaProviderAvailabilityRepository jpaProviderAvailabilityRepository;

    @Override
    public Optional<ProviderAvailability> findByProviderId(String providerId) {
        log.debug("Finding availability: providerId={}", providerId);
        return EntityIds.findWithFallback(providerId, jpaProviderAvailabilityRepository::findByProviderId)
                .map(ProviderAvailabilityEntity::toDomain);
    }

    @Override
    public ProviderAvailability save(ProviderAvailability availability) {
        // 기존 레코드가 있으면 식별자를 이어받아 교체
        String id = jpaProviderAvailabilityRepository.findByProviderId(availability.providerId())
                .map(ProviderAvailabilityEntity::getId)
                .orElseGet(() -> availability.id() != null ? availability.id() : EntityIds.newId());

        ProviderAvailability toSave = new ProviderAvailability(
                id, availability.providerId(), availability.businessHours(), availability.blockedDates());
        return jpaProviderAvailabilityRepository.save(ProviderAvailabilityEntity.fromDomain(toSave)).toDomain();
    }

    @Override
    @Transactional
    public void deleteByProviderId(String providerId) {
        jpaProviderAvailabilityRepository.deleteByProviderId(providerId);
    }
}
