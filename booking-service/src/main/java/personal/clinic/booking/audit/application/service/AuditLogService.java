package personal.clinic.booking.audit.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.audit.application.port.in.AuditLogPage;
import personal.clinic.booking.audit.application.port.in.AuditLogSearchQuery;
import personal.clinic.booking.audit.application.port.in.QueryAuditLogsUseCase;
import personal.clinic.booking.audit.application.port.in.RecordAuditUseCase;
import personal.clinic.booking.audit.application.port.out.AuditLogRepository;
import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.AuditStatus;
import personal.clinic.booking.audit.domain.model.AuditSummary;
import personal.clinic.booking.store.StoreQuery;

import java.time.Instant;
import java.util.List;

/**
 * Audit Log Service
 * 감사 로그 기록/조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService implements RecordAuditUseCase, QueryAuditLogsUseCase {

    private static final int TOP_USERS_LIMIT = 10;
    private static final Instant MIN_TIME = Instant.EPOCH;
    private static final Instant MAX_TIME = Instant.parse("9999-12-31T23:59:59Z");

    private final AuditLogRepository auditLogRepository;

    @Override
    @Transactional
    public void record(AuditLog auditLog) {
        auditLogRepository.save(auditLog);
        log.debug("Audit recorded: action={}, entityType={}, entityId={}",
                auditLog.action(), auditLog.entityType(), auditLog.entityId());
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(AuditLog auditLog) {
        try {
            auditLogRepository.save(auditLog);
            log.debug("Audit failure recorded: action={}, entityId={}", auditLog.action(), auditLog.entityId());
        } catch (RuntimeException e) {
            // 실패 기록이 원래 오류를 가리지 않도록 여기서 종료
            log.error("Failed to record audit failure: action={}, entityId={}",
                    auditLog.action(), auditLog.entityId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public AuditLogPage search(AuditLogSearchQuery query) {
        StoreQuery filter = filter(query).build();
        StoreQuery paged = filter(query)
                .orderByDesc("timestamp")
                .limit(query.limit())
                .skip(query.skip())
                .build();

        List<AuditLog> logs = auditLogRepository.findAll(paged);
        long total = auditLogRepository.count(filter);
        return new AuditLogPage(logs, total, query.limit(), query.skip());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLog> entityTrail(AuditEntityType entityType, String entityId) {
        return auditLogRepository.findAll(StoreQuery.where()
                .eq("entityType", entityType)
                .eq("entityId", entityId)
                .orderByDesc("timestamp")
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public AuditSummary summarize(Instant startDate, Instant endDate) {
        Instant from = startDate != null ? startDate : MIN_TIME;
        Instant to = endDate != null ? endDate : MAX_TIME;

        long total = auditLogRepository.count(range(from, to).build());
        long failed = auditLogRepository.count(range(from, to).eq("status", AuditStatus.FAILURE).build());

        return new AuditSummary(
                total,
                auditLogRepository.countByAction(from, to),
                failed,
                auditLogRepository.countByStaff(from, to, TOP_USERS_LIMIT),
                startDate,
                endDate);
    }

    private StoreQuery.Builder filter(AuditLogSearchQuery query) {
        return StoreQuery.where()
                .eq("entityType", query.entityType())
                .eq("entityId", query.entityId())
                .eq("action", query.action())
                .eq("staffEmail", query.staffEmail())
                .gte("timestamp", query.startDate())
                .lte("timestamp", query.endDate());
    }

    private StoreQuery.Builder range(Instant from, Instant to) {
        return StoreQuery.where()
                .gte("timestamp", from)
                .lte("timestamp", to);
    }
}
