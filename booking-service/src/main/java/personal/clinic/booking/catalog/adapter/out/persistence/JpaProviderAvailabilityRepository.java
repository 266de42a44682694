package personal.clinic.booking.catalog.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for ProviderAvailability
 */
public interface JpaProviderAvailabilityRepository extends JpaRepository<ProviderAvailabilityEntity, String> {

    Optional<ProviderAvailabilityEntity> findByProviderId(String providerId);

    void deleteByProviderId(String providerId);
}
