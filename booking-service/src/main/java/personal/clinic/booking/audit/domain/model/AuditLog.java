package personal.clinic.booking.audit.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;
import java.util.Map;

/**
 * Audit Log Domain Model
 * 직원 변경 작업 기록 (추가 전용, 불변)
 */
public record AuditLog(
        Long id,
        String staffEmail,
        String action,
        AuditEntityType entityType,
        String entityId,
        String entityName,
        Map<String, AuditChange> changes,
        AuditStatus status,
        String errorMessage,
        String ipAddress,
        String userAgent,
        Instant timestamp) {

    public AuditLog {
        if (action == null || action.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Audit action cannot be blank");
        }
        if (entityType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Audit entity type cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Audit status cannot be null");
        }
        if (timestamp == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Audit timestamp cannot be null");
        }
        changes = changes == null ? Map.of() : Map.copyOf(changes);
    }

    public static AuditLog success(StaffActor actor, String action, AuditEntityType entityType, String entityId,
                                   String entityName, Map<String, AuditChange> changes, Instant now) {
        return new AuditLog(null, actor.email(), action, entityType, entityId, entityName, changes,
                AuditStatus.SUCCESS, null, actor.ipAddress(), actor.userAgent(), now);
    }

    public static AuditLog failure(StaffActor actor, String action, AuditEntityType entityType, String entityId,
                                   String errorMessage, Instant now) {
        return new AuditLog(null, actor.email(), action, entityType, entityId, null, Map.of(),
                AuditStatus.FAILURE, errorMessage, actor.ipAddress(), actor.userAgent(), now);
    }
}
