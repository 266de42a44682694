package personal.clinic.booking.audit.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * 기간별 감사 로그 요약
 *
 * @param actionsByType 작업 이름별 건수 (건수 내림차순)
 * @param topUsers      직원별 건수 상위 10명
 */
public record AuditSummary(
        long totalActions,
        Map<String, Long> actionsByType,
        long failedActions,
        Map<String, Long> topUsers,
        Instant startDate,
        Instant endDate) {
}
