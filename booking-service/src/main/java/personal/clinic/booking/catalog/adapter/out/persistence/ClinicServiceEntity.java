package personal.clinic.booking.catalog.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.booking.catalog.domain.model.ClinicService;
import personal.clinic.booking.catalog.domain.model.CustomField;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Clinic Service JPA Entity
 * 진료 서비스 테이블 매핑
 */
@Entity
@Table(name = "clinic_services")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClinicServiceEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private int duration;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "clinic_service_providers", joinColumns = @JoinColumn(name = "service_id"))
    @Column(name = "provider_id", length = 64)
    private Set<String> providerIds = new HashSet<>();

    @Convert(converter = CustomFieldListConverter.class)
    @Column(name = "custom_fields", columnDefinition = "TEXT")
    private List<CustomField> customFields;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ClinicServiceEntity fromDomain(ClinicService service) {
        ClinicServiceEntity entity = new ClinicServiceEntity();
        entity.id = service.id();
        entity.name = service.name();
        entity.description = service.description();
        entity.duration = service.duration();
        entity.providerIds = new HashSet<>(service.providerIds());
        entity.customFields = service.customFields();
        entity.createdAt = service.createdAt();
        entity.updatedAt = service.updatedAt();
        return entity;
    }

    public ClinicService toDomain() {
        return new ClinicService(id, name, description, duration, providerIds, customFields, createdAt, updatedAt);
    }
}
