package personal.clinic.booking.store;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 타입 있는 조회 조건 빌더
 * 조건은 모두 AND로 결합된다. 값이 null인 조건은 추가되지 않는다 (선택 필터).
 *
 * <pre>
 * StoreQuery.where()
 *         .eq("providerId", providerId)
 *         .in("status", AppointmentStatus.ACTIVE)
 *         .lt("startTime", end)
 *         .gt("endTime", start)
 *         .build();
 * </pre>
 */
public final class StoreQuery {

    private final List<Condition> conditions;
    private final Sort sort;
    private final Integer limit;
    private final int skip;

    private StoreQuery(Builder builder) {
        this.conditions = List.copyOf(builder.conditions);
        this.sort = builder.sort;
        this.limit = builder.limit;
        this.skip = builder.skip;
    }

    public static Builder where() {
        return new Builder();
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public Sort sort() {
        return sort;
    }

    public boolean isPaged() {
        return limit != null;
    }

    public Pageable toPageable() {
        if (limit == null) {
            return Pageable.unpaged(sort);
        }
        return new OffsetPageRequest(skip, limit, sort);
    }

    public <T> StoreQuerySpecification<T> toSpecification() {
        return new StoreQuerySpecification<>(conditions);
    }

    public static final class Builder {

        private final List<Condition> conditions = new ArrayList<>();
        private Sort sort = Sort.unsorted();
        private Integer limit;
        private int skip;

        private Builder() {
        }

        public Builder eq(String field, Object value) {
            return add(field, Operator.EQ, value);
        }

        public Builder ne(String field, Object value) {
            return add(field, Operator.NE, value);
        }

        public Builder in(String field, Collection<?> values) {
            return add(field, Operator.IN, values);
        }

        public Builder lt(String field, Comparable<?> value) {
            return add(field, Operator.LT, value);
        }

        public Builder lte(String field, Comparable<?> value) {
            return add(field, Operator.LTE, value);
        }

        public Builder gt(String field, Comparable<?> value) {
            return add(field, Operator.GT, value);
        }

        public Builder gte(String field, Comparable<?> value) {
            return add(field, Operator.GTE, value);
        }

        public Builder orderByAsc(String field) {
            this.sort = sort.and(Sort.by(Sort.Direction.ASC, field));
            return this;
        }

        public Builder orderByDesc(String field) {
            this.sort = sort.and(Sort.by(Sort.Direction.DESC, field));
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public Builder skip(int skip) {
            if (skip < 0) {
                throw new IllegalArgumentException("skip cannot be negative: " + skip);
            }
            this.skip = skip;
            return this;
        }

        public StoreQuery build() {
            return new StoreQuery(this);
        }

        private Builder add(String field, Operator operator, Object value) {
            if (value != null) {
                conditions.add(new Condition(field, operator, value));
            }
            return this;
        }
    }
}
