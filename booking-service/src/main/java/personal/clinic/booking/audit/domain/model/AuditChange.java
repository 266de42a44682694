package personal.clinic.booking.audit.domain.model;

/**
 * 필드 단위 변경 내역 (before -> after)
 */
public record AuditChange(
        Object before,
        Object after) {
}
