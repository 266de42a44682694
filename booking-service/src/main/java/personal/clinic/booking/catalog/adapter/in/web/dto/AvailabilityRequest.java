package personal.clinic.booking.catalog.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.clinic.booking.catalog.application.port.in.ReplaceAvailabilityCommand;
import personal.clinic.booking.catalog.domain.model.BusinessHours;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * 근무 시간 교체 요청 DTO
 * 시간은 HH:mm, 휴무일은 YYYY-MM-DD
 */
public record AvailabilityRequest(
        @NotNull(message = "businessHours is required")
        @Size(max = 7, message = "At most 7 business hours entries are allowed")
        List<@Valid BusinessHoursRequest> businessHours,

        Set<LocalDate> blockedDates
) {
    public ReplaceAvailabilityCommand toCommand() {
        List<BusinessHours> hours = businessHours.stream()
                .map(BusinessHoursRequest::toDomain)
                .toList();
        return new ReplaceAvailabilityCommand(hours, blockedDates);
    }

    public record BusinessHoursRequest(
            @NotNull @Min(0) @Max(6)
            Integer dayOfWeek,

            @JsonProperty("isOpen")
            boolean isOpen,

            @JsonFormat(pattern = "HH:mm")
            LocalTime startTime,

            @JsonFormat(pattern = "HH:mm")
            LocalTime endTime
    ) {
        BusinessHours toDomain() {
            return new BusinessHours(dayOfWeek, isOpen, startTime, endTime);
        }
    }
}
