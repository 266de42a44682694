package personal.clinic.booking.catalog.application.port.out;

import personal.clinic.booking.catalog.domain.model.ProviderAvailability;

import java.util.Optional;

/**
 * Provider Availability Repository (Output Port)
 * 의료진당 하나의 근무 시간 레코드
 */
public interface ProviderAvailabilityRepository {

    Optional<ProviderAvailability> findByProviderId(String providerId);

    /**
     * 근무 시간 저장 (없으면 생성, 있으면 교체)
     */
    ProviderAvailability save(ProviderAvailability availability);

    void deleteByProviderId(String providerId);
}
