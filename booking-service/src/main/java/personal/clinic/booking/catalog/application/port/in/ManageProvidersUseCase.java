package personal.clinic.booking.catalog.application.port.in;

import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.catalog.domain.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Manage Providers UseCase (Input Port)
 */
public interface ManageProvidersUseCase {

    /**
     * @param serviceId null이면 전체, 아니면 해당 서비스를 제공하는 의료진만
     */
    List<Provider> getProviders(String serviceId);

    Provider getProvider(String providerId);

    Optional<Provider> findProvider(String providerId);

    Provider createProvider(SaveProviderCommand command, StaffActor actor);

    Provider updateProvider(String providerId, SaveProviderCommand command, StaffActor actor);

    /**
     * 의료진과 근무 시간 레코드를 함께 삭제
     */
    void deleteProvider(String providerId, StaffActor actor);
}
