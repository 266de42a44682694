package personal.clinic.booking.audit.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import personal.clinic.booking.audit.application.port.in.AuditLogPage;
import personal.clinic.booking.audit.application.port.in.AuditLogSearchQuery;
import personal.clinic.booking.audit.application.port.out.AuditLogRepository;
import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.AuditSummary;
import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.store.Condition;
import personal.clinic.booking.store.Operator;
import personal.clinic.booking.store.StoreQuery;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuditLogService 단위 테스트")
class AuditLogServiceTest {

    private static final Instant NOW = Instant.parse("2030-03-01T12:00:00Z");

    @Mock
    private AuditLogRepository auditLogRepository;

    @InjectMocks
    private AuditLogService auditLogService;

    @Test
    @DisplayName("검색: 지정한 필터만 조건이 되고 페이지 정보와 전체 건수를 함께 반환한다")
    void searchAppliesOnlyGivenFilters() {
        // given
        given(auditLogRepository.findAll(any(StoreQuery.class))).willReturn(List.of());
        given(auditLogRepository.count(any(StoreQuery.class))).willReturn(42L);

        // when
        AuditLogPage page = auditLogService.search(new AuditLogSearchQuery(
                AuditEntityType.APPOINTMENT, null, "cancel", null, null, null, 20, 40));

        // then
        assertThat(page.total()).isEqualTo(42L);
        ArgumentCaptor<StoreQuery> captor = ArgumentCaptor.forClass(StoreQuery.class);
        then(auditLogRepository).should().findAll(captor.capture());
        StoreQuery query = captor.getValue();
        assertThat(query.conditions())
                .extracting(Condition::field, Condition::operator, Condition::value)
                .containsExactly(
                        tuple("entityType", Operator.EQ, AuditEntityType.APPOINTMENT),
                        tuple("action", Operator.EQ, "cancel"));
        assertThat(query.toPageable().getOffset()).isEqualTo(40);
    }

    @Test
    @DisplayName("요약: 전체, 실패, 작업별, 직원별 건수를 모은다")
    void summarize() {
        // given
        given(auditLogRepository.count(any(StoreQuery.class))).willReturn(10L, 2L);
        given(auditLogRepository.countByAction(any(), any())).willReturn(Map.of("update", 7L, "cancel", 3L));
        given(auditLogRepository.countByStaff(any(), any(), eq(10))).willReturn(Map.of("staff@clinic.com", 10L));

        // when
        AuditSummary summary = auditLogService.summarize(null, NOW);

        // then
        assertThat(summary.totalActions()).isEqualTo(10L);
        assertThat(summary.failedActions()).isEqualTo(2L);
        assertThat(summary.actionsByType()).containsEntry("update", 7L);
        assertThat(summary.topUsers()).containsOnlyKeys("staff@clinic.com");
        assertThat(summary.startDate()).isNull();
        then(auditLogRepository).should(times(2)).count(any(StoreQuery.class));
    }

    @Test
    @DisplayName("실패 기록 저장이 실패해도 예외를 던지지 않는다")
    void recordFailureDoesNotThrow() {
        // given
        AuditLog failure = AuditLog.failure(new StaffActor("staff@clinic.com", null, null), "update",
                AuditEntityType.SETTINGS, "notifications", "boom", NOW);
        given(auditLogRepository.save(failure)).willThrow(new DataAccessResourceFailureException("db down"));

        // when & then
        assertThatCode(() -> auditLogService.recordFailure(failure)).doesNotThrowAnyException();
    }
}
