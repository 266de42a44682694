package personal.clinic.booking.audit.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditChanges 단위 테스트")
class AuditChangesTest {

    @Test
    @DisplayName("값이 다른 필드만 키 이름 순으로 추출한다")
    void detectsOnlyChangedFields() {
        Map<String, Object> before = new HashMap<>();
        before.put("name", "Dr. Kim");
        before.put("phone", "555-0000");
        before.put("speciality", null);
        Map<String, Object> after = new HashMap<>();
        after.put("name", "Dr. Kim");
        after.put("phone", "555-1111");
        after.put("speciality", "Dermatology");

        Map<String, AuditChange> changes = AuditChanges.detect(before, after);

        assertThat(changes.keySet()).containsExactly("phone", "speciality");
        assertThat(changes.get("speciality")).isEqualTo(new AuditChange(null, "Dermatology"));
    }

    @Test
    @DisplayName("생성(이전 없음)은 모든 필드를 변경으로 본다")
    void creationFromNull() {
        Map<String, AuditChange> changes = AuditChanges.detect(null, Map.of("name", "Checkup"));

        assertThat(changes).containsEntry("name", new AuditChange(null, "Checkup"));
    }
}
