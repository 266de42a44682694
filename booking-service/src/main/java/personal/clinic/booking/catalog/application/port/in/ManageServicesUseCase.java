package personal.clinic.booking.catalog.application.port.in;

import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.catalog.domain.model.ClinicService;

import java.util.List;
import java.util.Optional;

/**
 * Manage Services UseCase (Input Port)
 * 진료 서비스 CRUD
 */
public interface ManageServicesUseCase {

    List<ClinicService> getServices();

    /**
     * @throws personal.clinic.booking.catalog.domain.exception.ServiceNotFoundException 서비스가 없을 때
     */
    ClinicService getService(String serviceId);

    /**
     * 존재하지 않아도 예외를 던지지 않는 조회 (알림 변수 구성 등)
     */
    Optional<ClinicService> findService(String serviceId);

    ClinicService createService(SaveServiceCommand command, StaffActor actor);

    ClinicService updateService(String serviceId, SaveServiceCommand command, StaffActor actor);

    void deleteService(String serviceId, StaffActor actor);
}
