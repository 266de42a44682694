package personal.clinic.booking.appointment.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.appointment.domain.model.TimeSlot;
import personal.clinic.booking.catalog.domain.model.BusinessHours;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;
import personal.clinic.common.exception.BusinessException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AvailabilityResolver 단위 테스트")
class AvailabilityResolverTest {

    private static final ZoneId ZONE = ZoneOffset.UTC;
    private static final LocalDate MONDAY = LocalDate.of(2030, 3, 4);
    private static final LocalDate SUNDAY = LocalDate.of(2030, 3, 3);

    private AvailabilityResolver resolver;
    private ProviderAvailability availability;

    @BeforeEach
    void setUp() {
        resolver = new AvailabilityResolver(new Random(42));
        availability = new ProviderAvailability("avail-1", "provider-1",
                List.of(BusinessHours.closed(0), BusinessHours.open(1, LocalTime.of(9, 0), LocalTime.of(17, 0))),
                Set.of(LocalDate.of(2030, 3, 11)));
    }

    private static Instant at(int hour, int minute) {
        return MONDAY.atTime(hour, minute).atZone(ZONE).toInstant();
    }

    @Test
    @DisplayName("09:00-17:00 근무, 30분 단위, 10:00 예약 1건 -> 후보 15개, 반환 8개, 10:00 제외")
    void resolvesSlotsAroundExistingBooking() {
        // given
        TimeInterval window = resolver.openWindow(availability, MONDAY, ZONE).orElseThrow();
        List<TimeInterval> booked = List.of(new TimeInterval(at(10, 0), at(10, 30)));

        // when
        List<TimeSlot> free = resolver.freeSlots(window, 30, booked);
        List<TimeSlot> sampled = resolver.sample(free, 8);

        // then
        assertThat(free).hasSize(15);
        assertThat(sampled).hasSize(8);
        assertThat(sampled).extracting(TimeSlot::startTime).doesNotContain(at(10, 0));
        assertThat(sampled).allSatisfy(slot -> {
            assertThat(slot.startTime()).isAfterOrEqualTo(at(9, 0));
            assertThat(slot.endTime()).isBeforeOrEqualTo(at(17, 0));
            assertThat(slot.interval().overlaps(booked.get(0))).isFalse();
        });
    }

    @Test
    @DisplayName("후보는 근무 시작부터 시간순으로 생성되고 마지막 슬롯은 근무 종료에 맞닿는다")
    void freeSlotsAreOrderedAndFitInsideWindow() {
        // given
        TimeInterval window = new TimeInterval(at(9, 0), at(10, 0));

        // when
        List<TimeSlot> free = resolver.freeSlots(window, 25, List.of());

        // then
        assertThat(free).extracting(TimeSlot::startTime).containsExactly(at(9, 0), at(9, 25));
        assertThat(free.get(1).endTime()).isEqualTo(at(9, 50));
    }

    @Test
    @DisplayName("후보가 maxResults보다 적으면 전부 반환")
    void sampleReturnsAllWhenFewerThanMax() {
        List<TimeSlot> slots = List.of(new TimeSlot(at(9, 0), at(9, 30)), new TimeSlot(at(9, 30), at(10, 0)));

        assertThat(resolver.sample(slots, 8)).containsExactlyInAnyOrderElementsOf(slots);
    }

    @Test
    @DisplayName("휴무일이면 근무 구간이 없다")
    void blockedDateHasNoWindow() {
        Optional<TimeInterval> window = resolver.openWindow(availability, LocalDate.of(2030, 3, 11), ZONE);

        assertThat(window).isEmpty();
    }

    @Test
    @DisplayName("휴무 요일이면 근무 구간이 없다")
    void closedDayHasNoWindow() {
        assertThat(resolver.openWindow(availability, SUNDAY, ZONE)).isEmpty();
    }

    @Test
    @DisplayName("근무 시간이 등록되지 않은 요일이면 근무 구간이 없다")
    void missingDayHasNoWindow() {
        assertThat(resolver.openWindow(availability, MONDAY.plusDays(1), ZONE)).isEmpty();
    }

    @Test
    @DisplayName("근무 구간은 클리닉 시간대 기준으로 계산된다")
    void windowUsesClinicZone() {
        ZoneId newYork = ZoneId.of("America/New_York");

        TimeInterval window = resolver.openWindow(availability, MONDAY, newYork).orElseThrow();

        assertThat(window.start()).isEqualTo(Instant.parse("2030-03-04T14:00:00Z"));
        assertThat(window.end()).isEqualTo(Instant.parse("2030-03-04T22:00:00Z"));
    }

    @Test
    @DisplayName("duration이 0 이하이면 예외")
    void rejectsNonPositiveDuration() {
        TimeInterval window = new TimeInterval(at(9, 0), at(10, 0));

        assertThatThrownBy(() -> resolver.freeSlots(window, 0, List.of()))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Duration");
    }

    @Test
    @DisplayName("서머타임 전환으로 근무 구간이 사라진 날은 빈 구간")
    void windowInsideSpringForwardGapIsEmpty() {
        // given: 2030-03-10 (일) 02:00-03:00 뉴욕은 존재하지 않는 시간
        LocalDate springForward = LocalDate.of(2030, 3, 10);
        ProviderAvailability nightShift = new ProviderAvailability("avail-2", "provider-2",
                List.of(BusinessHours.open(0, LocalTime.of(2, 0), LocalTime.of(3, 0))), Set.of());

        // when
        Optional<TimeInterval> window = resolver.openWindow(nightShift, springForward, ZoneId.of("America/New_York"));

        // then
        assertThat(window).isEmpty();
    }
}
