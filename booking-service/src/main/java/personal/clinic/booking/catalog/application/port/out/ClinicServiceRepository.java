package personal.clinic.booking.catalog.application.port.out;

import personal.clinic.booking.catalog.domain.model.ClinicService;

import java.util.List;
import java.util.Optional;

/**
 * Clinic Service Repository (Output Port)
 */
public interface ClinicServiceRepository {

    ClinicService save(ClinicService service);

    /**
     * 서비스 조회 (정규화 식별자 -> 원문 식별자 순서)
     */
    Optional<ClinicService> findById(String serviceId);

    List<ClinicService> findAll();

    /**
     * @return 삭제된 경우 true
     */
    boolean deleteById(String serviceId);
}
