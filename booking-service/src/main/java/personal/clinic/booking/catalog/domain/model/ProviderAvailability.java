package personal.clinic.booking.catalog.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Provider Availability Domain Model
 * 의료진 1명당 1개: 요일별 근무 시간(최대 7개) + 휴무일 목록
 */
public record ProviderAvailability(
        String id,
        String providerId,
        List<BusinessHours> businessHours,
        Set<LocalDate> blockedDates) {

    public ProviderAvailability {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be blank");
        }
        businessHours = businessHours == null ? List.of() : businessHours.stream()
                .sorted(Comparator.comparingInt(BusinessHours::dayOfWeek))
                .toList();
        blockedDates = blockedDates == null ? Set.of() : Set.copyOf(blockedDates);

        Set<Integer> seen = new HashSet<>();
        for (BusinessHours hours : businessHours) {
            if (!seen.add(hours.dayOfWeek())) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Duplicate business hours for dayOfWeek=" + hours.dayOfWeek());
            }
        }
    }

    /**
     * 날짜의 요일 인덱스 (0=일요일 ... 6=토요일)
     */
    public static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    public Optional<BusinessHours> hoursFor(LocalDate date) {
        int day = dayIndex(date);
        return businessHours.stream()
                .filter(hours -> hours.dayOfWeek() == day)
                .findFirst();
    }

    public boolean isBlocked(LocalDate date) {
        return blockedDates.contains(date);
    }

    public ProviderAvailability replace(List<BusinessHours> newHours, Set<LocalDate> newBlockedDates) {
        return new ProviderAvailability(id, providerId, newHours, newBlockedDates);
    }
}
