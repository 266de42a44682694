package personal.clinic.booking.catalog.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Provider Availability JPA Entity
 * 의료진별 근무 시간/휴무일 매핑 (provider_id 유일)
 */
@Entity
@Table(name = "provider_availability",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_availability_provider",
                columnNames = {"provider_id"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProviderAvailabilityEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "provider_id", nullable = false, length = 64)
    private String providerId;

    // 두 컬렉션을 함께 EAGER 로딩하므로 bag(List) 대신 Set 사용
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_business_hours", joinColumns = @JoinColumn(name = "availability_id"))
    private Set<BusinessHoursEmbeddable> businessHours = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_blocked_dates", joinColumns = @JoinColumn(name = "availability_id"))
    @Column(name = "blocked_date")
    private Set<LocalDate> blockedDates = new HashSet<>();

    public static ProviderAvailabilityEntity fromDomain(ProviderAvailability availability) {
        ProviderAvailabilityEntity entity = new ProviderAvailabilityEntity();
        entity.id = availability.id();
        entity.providerId = availability.providerId();
        entity.businessHours = availability.businessHours().stream()
                .map(BusinessHoursEmbeddable::fromDomain)
                .collect(Collectors.toCollection(HashSet::new));
        entity.blockedDates = new HashSet<>(availability.blockedDates());
        return entity;
    }

    public ProviderAvailability toDomain() {
        return new ProviderAvailability(
                id,
                providerId,
                businessHours.stream().map(BusinessHoursEmbeddable::toDomain).toList(),
                blockedDates);
    }
}
