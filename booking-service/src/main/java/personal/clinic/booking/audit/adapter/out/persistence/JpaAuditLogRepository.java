package personal.clinic.booking.audit.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA Repository for AuditLog
 */
public interface JpaAuditLogRepository extends JpaRepository<AuditLogEntity, Long>,
        JpaSpecificationExecutor<AuditLogEntity> {

    @Query("SELECT a.action, COUNT(a) FROM AuditLogEntity a " +
            "WHERE a.timestamp BETWEEN :from AND :to " +
            "GROUP BY a.action ORDER BY COUNT(a) DESC")
    List<Object[]> countGroupByAction(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT a.staffEmail, COUNT(a) FROM AuditLogEntity a " +
            "WHERE a.timestamp BETWEEN :from AND :to AND a.staffEmail IS NOT NULL " +
            "GROUP BY a.staffEmail ORDER BY COUNT(a) DESC")
    List<Object[]> countGroupByStaff(@Param("from") Instant from, @Param("to") Instant to, Pageable pageable);
}
