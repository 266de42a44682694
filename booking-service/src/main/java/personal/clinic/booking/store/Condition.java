package personal.clinic.booking.store;

import java.util.Collection;

/**
 * 단일 조건 (field, operator, value)
 * field는 엔티티 속성 이름
 */
public record Condition(
        String field,
        Operator operator,
        Object value
) {
    public Condition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Condition field cannot be blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Condition operator cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Condition value cannot be null: field=" + field);
        }
        if (operator == Operator.IN && !(value instanceof Collection<?>)) {
            throw new IllegalArgumentException("IN condition requires a collection: field=" + field);
        }
        if (isRange(operator) && !(value instanceof Comparable<?>)) {
            throw new IllegalArgumentException("Range condition requires a comparable value: field=" + field);
        }
    }

    private static boolean isRange(Operator operator) {
        return operator == Operator.LT || operator == Operator.LTE
                || operator == Operator.GT || operator == Operator.GTE;
    }
}
