package personal.clinic.booking.catalog.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.clinic.booking.catalog.application.port.in.SaveServiceCommand;
import personal.clinic.booking.catalog.domain.model.CustomField;
import personal.clinic.booking.catalog.domain.model.CustomFieldType;

import java.util.List;
import java.util.Set;

/**
 * 진료 서비스 생성/수정 요청 DTO
 */
public record ServiceRequest(
        @NotBlank(message = "Service name is required")
        String name,

        String description,

        @NotNull(message = "Service duration is required")
        @Positive(message = "Service duration must be positive")
        Integer duration,

        Set<String> providerIds,

        List<@Valid CustomFieldRequest> customFields
) {
    public SaveServiceCommand toCommand() {
        List<CustomField> fields = customFields == null ? List.of() : customFields.stream()
                .map(CustomFieldRequest::toDomain)
                .toList();
        return new SaveServiceCommand(name.trim(), description, duration, providerIds, fields);
    }

    public record CustomFieldRequest(
            @NotBlank(message = "Custom field name is required")
            String name,

            @NotNull(message = "Custom field type is required")
            CustomFieldType type,

            boolean required,

            int order,

            List<String> options
    ) {
        CustomField toDomain() {
            return new CustomField(name, type, required, order, options);
        }
    }
}
