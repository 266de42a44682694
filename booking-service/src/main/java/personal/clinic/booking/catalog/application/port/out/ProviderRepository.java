package personal.clinic.booking.catalog.application.port.out;

import personal.clinic.booking.catalog.domain.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Provider Repository (Output Port)
 */
public interface ProviderRepository {

    Provider save(Provider provider);

    Optional<Provider> findById(String providerId);

    List<Provider> findAll();

    List<Provider> findByServiceId(String serviceId);

    boolean deleteById(String providerId);

    /**
     * 예약 쓰기 직렬화를 위한 의료진 행 잠금 (비관적 쓰기 락)
     * 반드시 트랜잭션 안에서 호출해야 하며, 잠금은 트랜잭션 종료 시 해제된다.
     *
     * @return 잠긴 의료진, 존재하지 않으면 empty
     */
    Optional<Provider> lockForBooking(String providerId);
}
