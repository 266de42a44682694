package personal.clinic.booking.catalog.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import personal.clinic.booking.catalog.domain.model.BusinessHours;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record AvailabilityResponse(
        String id,
        String providerId,
        List<BusinessHoursResponse> businessHours,
        List<LocalDate> blockedDates
) {
    public static AvailabilityResponse from(ProviderAvailability availability) {
        return new AvailabilityResponse(
                availability.id(),
                availability.providerId(),
                availability.businessHours().stream().map(BusinessHoursResponse::from).toList(),
                availability.blockedDates().stream().sorted().toList());
    }

    public record BusinessHoursResponse(
            int dayOfWeek,
            @JsonProperty("isOpen") boolean isOpen,
            @JsonFormat(pattern = "HH:mm") LocalTime startTime,
            @JsonFormat(pattern = "HH:mm") LocalTime endTime
    ) {
        static BusinessHoursResponse from(BusinessHours hours) {
            return new BusinessHoursResponse(hours.dayOfWeek(), hours.open(), hours.startTime(), hours.endTime());
        }
    }
}
