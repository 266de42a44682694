package personal.clinic.booking.catalog.application.port.in;

import personal.clinic.booking.catalog.domain.model.BusinessHours;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public record ReplaceAvailabilityCommand(
        List<BusinessHours> businessHours,
        Set<LocalDate> blockedDates
) {
}
