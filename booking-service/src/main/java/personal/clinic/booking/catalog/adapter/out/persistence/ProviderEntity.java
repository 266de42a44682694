package personal.clinic.booking.catalog.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.catalog.domain.model.Provider;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Provider JPA Entity
 * 의료진 테이블 매핑. 예약 쓰기 시 이 행에 비관적 락을 건다.
 */
@Entity
@Table(name = "providers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProviderEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 200)
    private String email;

    @Column(length = 50)
    private String phone;

    @Column(length = 200)
    private String speciality;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_services", joinColumns = @JoinColumn(name = "provider_id"))
    @Column(name = "service_id", length = 64)
    private Set<String> serviceIds = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ProviderEntity fromDomain(Provider provider) {
        ProviderEntity entity = new ProviderEntity();
        entity.id = provider.id();
        entity.name = provider.name();
        entity.email = provider.email();
        entity.phone = provider.phone();
        entity.speciality = provider.speciality();
        entity.serviceIds = new HashSet<>(provider.serviceIds());
        entity.createdAt = provider.createdAt();
        entity.updatedAt = provider.updatedAt();
        return entity;
    }

    public Provider toDomain() {
        return new Provider(id, name, email, phone, speciality, serviceIds, createdAt, updatedAt);
    }
}
