package personal.clinic.booking.catalog.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Provider
 */
public interface JpaProviderRepository extends JpaRepository<ProviderEntity, String> {

    /**
     * 특정 서비스를 제공하는 의료진 목록
     */
    @Query("SELECT p FROM ProviderEntity p WHERE :serviceId MEMBER OF p.serviceIds ORDER BY p.name")
    List<ProviderEntity> findByServiceId(@Param("serviceId") String serviceId);

    /**
     * 의료진 행 비관적 쓰기 락 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "10000"))
    @Query("SELECT p FROM ProviderEntity p WHERE p.id = :id")
    Optional<ProviderEntity> findByIdForUpdate(@Param("id") String id);
}
