package personal.clinic.booking.store;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
@DisplayName("StoreQuerySpecification 단위 테스트")
class StoreQuerySpecificationTest {

    @Mock
    private Root<Object> root;

    @Mock
    private CriteriaQuery<?> criteriaQuery;

    @Mock
    private CriteriaBuilder cb;

    @Mock
    private Path<Object> path;

    @Test
    @DisplayName("조건마다 연산자에 맞는 Criteria 술어를 만든다")
    void mapsEachOperatorToCriteriaPredicate() {
        // given
        Instant from = Instant.parse("2030-03-01T00:00:00Z");
        Instant to = Instant.parse("2030-04-01T00:00:00Z");
        List<String> statuses = List.of("pending", "confirmed");
        given(root.<Object>get(anyString())).willReturn(path);

        StoreQuery query = StoreQuery.where()
                .eq("providerId", "p1")
                .ne("patientEmail", "blocked@example.com")
                .in("status", statuses)
                .gte("startTime", from)
                .lt("startTime", to)
                .build();

        // when
        query.toSpecification().toPredicate(root, criteriaQuery, cb);

        // then
        then(cb).should().equal(path, "p1");
        then(cb).should().notEqual(path, "blocked@example.com");
        then(path).should().in(statuses);
        then(cb).should().greaterThanOrEqualTo(any(), eq(from));
        then(cb).should().lessThan(any(), eq(to));
        then(cb).should().and(any(), any(), any(), any(), any());
    }
}
