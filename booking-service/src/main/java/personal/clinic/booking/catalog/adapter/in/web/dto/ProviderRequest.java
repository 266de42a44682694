package personal.clinic.booking.catalog.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import personal.clinic.booking.catalog.application.port.in.SaveProviderCommand;

import java.util.Set;

/**
 * 의료진 생성/수정 요청 DTO
 */
public record ProviderRequest(
        @NotBlank(message = "Provider name is required")
        String name,

        @Email(message = "Provider email is invalid")
        String email,

        String phone,

        String speciality,

        Set<String> serviceIds
) {
    public SaveProviderCommand toCommand() {
        return new SaveProviderCommand(name.trim(), email, phone, speciality, serviceIds);
    }
}
