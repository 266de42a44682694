package personal.clinic.booking.catalog.adapter.in.web.dto;

import personal.clinic.booking.catalog.domain.model.ClinicService;
import personal.clinic.booking.catalog.domain.model.CustomField;

import java.time.Instant;
import java.util.List;

public record ServiceResponse(
        String id,
        String name,
        String description,
        int duration,
        List<String> providerIds,
        List<CustomField> customFields,
        Instant createdAt,
        Instant updatedAt
) {
    public static ServiceResponse from(ClinicService service) {
        return new ServiceResponse(
                service.id(),
                service.name(),
                service.description(),
                service.duration(),
                service.providerIds().stream().sorted().toList(),
                service.customFields(),
                service.createdAt(),
                service.updatedAt());
    }
}
