package personal.clinic.booking.audit.domain.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 변경 전/후 스냅샷 비교
 */
public final class AuditChanges {

    private AuditChanges() {
    }

    /**
     * 두 스냅샷에서 값이 다른 필드만 추출 (키 이름 순)
     */
    public static Map<String, AuditChange> detect(Map<String, ?> before, Map<String, ?> after) {
        Map<String, ?> safeBefore = before == null ? Map.of() : before;
        Map<String, ?> safeAfter = after == null ? Map.of() : after;

        Set<String> keys = new HashSet<>(safeBefore.keySet());
        keys.addAll(safeAfter.keySet());

        Map<String, AuditChange> changes = new LinkedHashMap<>();
        for (String key : new TreeSet<>(keys)) {
            Object oldValue = safeBefore.get(key);
            Object newValue = safeAfter.get(key);
            if (!Objects.equals(oldValue, newValue)) {
                changes.put(key, new AuditChange(oldValue, newValue));
            }
        }
        return changes;
    }

    public static Map<String, AuditChange> single(String field, Object before, Object after) {
        Map<String, AuditChange> changes = new LinkedHashMap<>();
        changes.put(field, new AuditChange(before, after));
        return changes;
    }
}
