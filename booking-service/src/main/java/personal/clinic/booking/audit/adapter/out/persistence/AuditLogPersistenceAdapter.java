package personal.clinic.booking.audit.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.clinic.booking.audit.application.port.out.AuditLogRepository;
import personal.clinic.booking.audit.domain.model.AuditChange;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.store.StoreQuery;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit Log Persistence Adapter
 * 변경 내역(changes)은 JSON 문자열로 저장
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogPersistenceAdapter implements AuditLogRepository {

    private static final TypeReference<Map<String, AuditChange>> CHANGES_TYPE = new TypeReference<>() {
    };

    private final JpaAuditLogRepository jpaAuditLogRepository;
    private final ObjectMapper objectMapper;

    @Override
    public AuditLog save(AuditLog auditLog) {
        AuditLogEntity entity = AuditLogEntity.create(
                auditLog.staffEmail(),
                auditLog.action(),
                auditLog.entityType(),
                auditLog.entityId(),
                auditLog.entityName(),
                writeChanges(auditLog.changes()),
                auditLog.status(),
                auditLog.errorMessage(),
                auditLog.ipAddress(),
                auditLog.userAgent(),
                auditLog.timestamp());
        return toDomain(jpaAuditLogRepository.save(entity));
    }

    @Override
    public List<AuditLog> findAll(StoreQuery query) {
        if (query.isPaged()) {
            return jpaAuditLogRepository.findAll(query.<AuditLogEntity>toSpecification(), query.toPageable())
                    .map(this::toDomain)
                    .getContent();
        }
        return jpaAuditLogRepository.findAll(query.<AuditLogEntity>toSpecification(), query.sort()).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public long count(StoreQuery query) {
        return jpaAuditLogRepository.count(query.<AuditLogEntity>toSpecification());
    }

    @Override
    public Map<String, Long> countByAction(Instant from, Instant to) {
        return toCountMap(jpaAuditLogRepository.countGroupByAction(from, to));
    }

    @Override
    public Map<String, Long> countByStaff(Instant from, Instant to, int limit) {
        return toCountMap(jpaAuditLogRepository.countGroupByStaff(from, to, PageRequest.of(0, limit)));
    }

    private Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private AuditLog toDomain(AuditLogEntity entity) {
        return new AuditLog(
                entity.getId(),
                entity.getStaffEmail(),
                entity.getAction(),
                entity.getEntityType(),
                entity.getEntityId(),
                entity.getEntityName(),
                readChanges(entity.getChangesJson()),
                entity.getStatus(),
                entity.getErrorMessage(),
                entity.getIpAddress(),
                entity.getUserAgent(),
                entity.getTimestamp());
    }

    private String writeChanges(Map<String, AuditChange> changes) {
        try {
            return objectMapper.writeValueAsString(changes);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit changes", e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to serialize audit changes", e);
        }
    }

    private Map<String, AuditChange> readChanges(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, CHANGES_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize audit changes", e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to deserialize audit changes", e);
        }
    }
}
