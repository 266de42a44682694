package personal.clinic.booking.audit.adapter.in.web;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.booking.audit.application.port.in.AuditLogPage;
import personal.clinic.booking.audit.application.port.in.AuditLogSearchQuery;
import personal.clinic.booking.audit.application.port.in.QueryAuditLogsUseCase;
import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.AuditSummary;

import java.time.Instant;
import java.util.List;

/**
 * Audit Log Controller
 * 직원 변경 이력 조회 API
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/admin/audit-logs")
@RequiredArgsConstructor
public class AuditLogController {

    private final QueryAuditLogsUseCase queryAuditLogsUseCase;

    @GetMapping
    public ResponseEntity<AuditLogPage> search(
            @RequestParam(required = false) AuditEntityType entityType,
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String staffEmail,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int skip) {

        log.debug("Audit log search: entityType={}, entityId={}, action={}, staffEmail={}",
                entityType, entityId, action, staffEmail);

        AuditLogPage page = queryAuditLogsUseCase.search(new AuditLogSearchQuery(
                entityType, entityId, action, staffEmail, startDate, endDate, limit, skip));
        return ResponseEntity.ok(page);
    }

    @GetMapping("/summary")
    public ResponseEntity<AuditSummary> summary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate) {
        return ResponseEntity.ok(queryAuditLogsUseCase.summarize(startDate, endDate));
    }

    @GetMapping("/{entityType}/{entityId}")
    public ResponseEntity<List<AuditLog>> entityTrail(
            @PathVariable AuditEntityType entityType,
            @PathVariable String entityId) {
        return ResponseEntity.ok(queryAuditLogsUseCase.entityTrail(entityType, entityId));
    }
}
