package personal.clinic.booking.store;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;
import java.util.List;

/**
 * StoreQuery 조건 목록을 JPA Specification으로 변환
 */
public class StoreQuerySpecification<T> implements Specification<T> {

    private final List<Condition> conditions;

    StoreQuerySpecification(List<Condition> conditions) {
        this.conditions = conditions;
    }

    @Override
    public Predicate toPredicate(Root<T> root, CriteriaQuery<?> query, CriteriaBuilder cb) {
        Predicate[] predicates = conditions.stream()
                .map(condition -> toPredicate(root, cb, condition))
                .toArray(Predicate[]::new);
        return cb.and(predicates);
    }

    private Predicate toPredicate(Root<T> root, CriteriaBuilder cb, Condition condition) {
        Path<Object> path = root.get(condition.field());
        Object value = condition.value();

        return switch (condition.operator()) {
            case EQ -> cb.equal(path, value);
            case NE -> cb.notEqual(path, value);
            case IN -> path.in((Collection<?>) value);
            case LT, LTE, GT, GTE -> compare(root, cb, condition);
        };
    }

    /**
     * 범위 조건 (값이 Comparable인지는 Condition 생성 시 검증됨)
     */
    private static <Y extends Comparable<? super Y>> Predicate compare(Root<?> root, CriteriaBuilder cb,
                                                                       Condition condition) {
        Path<Y> path = root.get(condition.field());
        @SuppressWarnings("unchecked")
        Y value = (Y) condition.value();

        return switch (condition.operator()) {
            case LT -> cb.lessThan(path, value);
            case LTE -> cb.lessThanOrEqualTo(path, value);
            case GT -> cb.greaterThan(path, value);
            case GTE -> cb.greaterThanOrEqualTo(path, value);
            case EQ, NE, IN -> throw new IllegalArgumentException(
                    "Not a range operator: " + condition.operator());
        };
    }
}
