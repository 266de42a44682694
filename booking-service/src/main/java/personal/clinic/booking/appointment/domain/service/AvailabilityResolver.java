package personal.clinic.booking.appointment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.appointment.domain.model.TimeSlot;
import personal.clinic.booking.catalog.domain.model.BusinessHours;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Availability Resolver (Domain Service)
 * 근무 시간과 기존 예약으로부터 예약 가능한 시간대를 계산한다.
 *
 * <ol>
 *     <li>해당 요일 근무 시간이 없거나 휴무면 빈 목록</li>
 *     <li>휴무일(blockedDates)이면 빈 목록</li>
 *     <li>근무 시작부터 duration 간격으로 후보 생성 (cursor + duration <= 근무 종료)</li>
 *     <li>활성 예약과 겹치는 후보 제외</li>
 *     <li>무작위로 섞어 최대 maxResults개 반환</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityResolver {

    private final Random slotRandom;

    /**
     * 해당 날짜의 근무 구간 (클리닉 시간대 기준)
     *
     * @return 휴무이거나 휴무일이면 empty
     */
    public Optional<TimeInterval> openWindow(ProviderAvailability availability, LocalDate date, ZoneId zone) {
        if (availability.isBlocked(date)) {
            log.debug("Date is blocked: providerId={}, date={}", availability.providerId(), date);
            return Optional.empty();
        }
        Optional<BusinessHours> hours = availability.hoursFor(date).filter(BusinessHours::open);
        if (hours.isEmpty()) {
            log.debug("Provider is closed: providerId={}, date={}", availability.providerId(), date);
            return Optional.empty();
        }
        Instant dayStart = date.atTime(hours.get().startTime()).atZone(zone).toInstant();
        Instant dayEnd = date.atTime(hours.get().endTime()).atZone(zone).toInstant();
        if (!dayStart.isBefore(dayEnd)) {
            // 서머타임 전환으로 근무 구간 전체가 사라진 날
            log.debug("Open window collapsed: providerId={}, date={}, zone={}", availability.providerId(), date, zone);
            return Optional.empty();
        }
        return Optional.of(new TimeInterval(dayStart, dayEnd));
    }

    /**
     * 근무 구간 안의 모든 후보 중 기존 예약과 겹치지 않는 시간대 (시간순)
     */
    public List<TimeSlot> freeSlots(TimeInterval window, int durationMinutes, List<TimeInterval> booked) {
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Duration must be a positive number of minutes: " + durationMinutes);
        }
        Duration step = Duration.ofMinutes(durationMinutes);
        List<TimeSlot> slots = new ArrayList<>();

        Instant cursor = window.start();
        while (!cursor.plus(step).isAfter(window.end())) {
            TimeInterval candidate = new TimeInterval(cursor, cursor.plus(step));
            boolean conflict = booked.stream().anyMatch(candidate::overlaps);
            if (!conflict) {
                slots.add(new TimeSlot(candidate.start(), candidate.end()));
            }
            cursor = cursor.plus(step);
        }
        return slots;
    }

    /**
     * 균등 셔플 후 최대 maxResults개
     */
    public List<TimeSlot> sample(List<TimeSlot> slots, int maxResults) {
        List<TimeSlot> shuffled = new ArrayList<>(slots);
        Collections.shuffle(shuffled, slotRandom);
        return List.copyOf(shuffled.subList(0, Math.min(maxResults, shuffled.size())));
    }
}
