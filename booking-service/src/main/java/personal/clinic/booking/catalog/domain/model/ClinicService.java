package personal.clinic.booking.catalog.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.booking.store.EntityIds;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Clinic Service Domain Model
 * 예약 가능한 진료 서비스 (불변)
 *
 * @param duration 기본 진료 시간 (분)
 */
public record ClinicService(
        String id,
        String name,
        String description,
        int duration,
        Set<String> providerIds,
        List<CustomField> customFields,
        Instant createdAt,
        Instant updatedAt) {

    public ClinicService {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, "Service name is required");
        }
        if (duration <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service duration must be positive: " + duration);
        }
        providerIds = providerIds == null ? Set.of() : Set.copyOf(providerIds);
        customFields = customFields == null ? List.of() : customFields.stream()
                .sorted(Comparator.comparingInt(CustomField::order))
                .toList();
    }

    public static ClinicService create(String name, String description, int duration, Set<String> providerIds,
                                       List<CustomField> customFields, Instant now) {
        return new ClinicService(EntityIds.newId(), name, description, duration, providerIds, customFields,
                now, now);
    }

    public ClinicService update(String name, String description, int duration, Set<String> providerIds,
                                List<CustomField> customFields, Instant now) {
        return new ClinicService(id, name, description, duration, providerIds, customFields, createdAt, now);
    }
}
