package personal.clinic.booking.catalog.adapter.in.web.dto;

import personal.clinic.booking.catalog.domain.model.Provider;

import java.time.Instant;
import java.util.List;

public record ProviderResponse(
        String id,
        String name,
        String email,
        String phone,
        String speciality,
        List<String> serviceIds,
        Instant createdAt,
        Instant updatedAt
) {
    public static ProviderResponse from(Provider provider) {
        return new ProviderResponse(
                provider.id(),
                provider.name(),
                provider.email(),
                provider.phone(),
                provider.speciality(),
                provider.serviceIds().stream().sorted().toList(),
                provider.createdAt(),
                provider.updatedAt());
    }
}
