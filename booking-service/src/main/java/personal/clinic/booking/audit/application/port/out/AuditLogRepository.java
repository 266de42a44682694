package personal.clinic.booking.audit.application.port.out;

import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.store.StoreQuery;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit Log Repository (Output Port)
 */
public interface AuditLogRepository {

    AuditLog save(AuditLog auditLog);

    List<AuditLog> findAll(StoreQuery query);

    long count(StoreQuery query);

    /**
     * 기간 내 작업 이름별 건수 (건수 내림차순)
     */
    Map<String, Long> countByAction(Instant from, Instant to);

    /**
     * 기간 내 직원별 건수 상위 limit명
     */
    Map<String, Long> countByStaff(Instant from, Instant to, int limit);
}
