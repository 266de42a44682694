package personal.clinic.booking.audit.application.port.in;

import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.AuditSummary;

import java.time.Instant;
import java.util.List;

/**
 * Query Audit Logs UseCase (Input Port)
 */
public interface QueryAuditLogsUseCase {

    AuditLogPage search(AuditLogSearchQuery query);

    /**
     * 특정 엔티티의 변경 이력 (최신순)
     */
    List<AuditLog> entityTrail(AuditEntityType entityType, String entityId);

    AuditSummary summarize(Instant startDate, Instant endDate);
}
