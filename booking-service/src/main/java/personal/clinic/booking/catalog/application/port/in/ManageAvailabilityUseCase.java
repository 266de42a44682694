package personal.clinic.booking.catalog.application.port.in;

import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;

/**
 * Manage Availability UseCase (Input Port)
 * 의료진 근무 시간 조회/교체
 */
public interface ManageAvailabilityUseCase {

    /**
     * @throws personal.clinic.booking.catalog.domain.exception.ProviderAvailabilityNotFoundException 레코드가 없을 때
     */
    ProviderAvailability getAvailability(String providerId);

    /**
     * 근무 시간 전체 교체 (없으면 생성)
     *
     * @throws personal.clinic.booking.catalog.domain.exception.ProviderNotFoundException 의료진이 없을 때
     */
    ProviderAvailability replaceAvailability(String providerId, ReplaceAvailabilityCommand command, StaffActor actor);
}
