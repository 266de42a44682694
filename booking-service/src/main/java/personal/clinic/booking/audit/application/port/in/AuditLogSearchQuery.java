package personal.clinic.booking.audit.application.port.in;

import personal.clinic.booking.audit.domain.model.AuditEntityType;

import java.time.Instant;

/**
 * 감사 로그 검색 조건. null인 필드는 필터로 사용하지 않는다.
 */
public record AuditLogSearchQuery(
        AuditEntityType entityType,
        String entityId,
        String action,
        String staffEmail,
        Instant startDate,
        Instant endDate,
        int limit,
        int skip) {
}
