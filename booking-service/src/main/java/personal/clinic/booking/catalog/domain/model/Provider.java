package personal.clinic.booking.catalog.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.booking.store.EntityIds;

import java.time.Instant;
import java.util.Set;

/**
 * Provider Domain Model
 * 의료진 (불변)
 */
public record Provider(
        String id,
        String name,
        String email,
        String phone,
        String speciality,
        Set<String> serviceIds,
        Instant createdAt,
        Instant updatedAt) {

    public Provider {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.MISSING_REQUIRED_FIELD, "Provider name is required");
        }
        serviceIds = serviceIds == null ? Set.of() : Set.copyOf(serviceIds);
    }

    public static Provider create(String name, String email, String phone, String speciality,
                                  Set<String> serviceIds, Instant now) {
        return new Provider(EntityIds.newId(), name, email, phone, speciality, serviceIds, now, now);
    }

    public Provider update(String name, String email, String phone, String speciality,
                           Set<String> serviceIds, Instant now) {
        return new Provider(id, name, email, phone, speciality, serviceIds, createdAt, now);
    }

    public boolean offers(String serviceId) {
        return serviceIds.contains(serviceId);
    }
}
