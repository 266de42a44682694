package personal.clinic.booking.appointment.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.booking.appointment.application.port.out.AppointmentNotificationPort;
import personal.clinic.booking.appointment.application.port.out.AppointmentRepository;
import personal.clinic.booking.appointment.domain.exception.DoubleBookingException;
import personal.clinic.booking.appointment.domain.exception.InvalidStatusTransitionException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.catalog.application.port.out.ProviderRepository;
import personal.clinic.booking.catalog.domain.exception.ProviderNotFoundException;
import personal.clinic.booking.catalog.domain.model.Provider;
import personal.clinic.booking.store.Condition;
import personal.clinic.booking.store.Operator;
import personal.clinic.booking.store.StoreQuery;
import personal.clinic.common.exception.ErrorCode;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingConflictGuard 단위 테스트")
class BookingConflictGuardTest {

    private static final String PROVIDER_ID = "aaaaaaaaaaaaaaaaaaaaaaaa";
    private static final Instant NOW = Instant.parse("2030-03-01T12:00:00Z");
    private static final Instant START = Instant.parse("2030-03-04T15:00:00Z");

    @Mock
    private ProviderRepository providerRepository;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private AppointmentNotificationPort appointmentNotificationPort;
    @InjectMocks
    private BookingConflictGuard guard;

    private static Provider provider() {
        return new Provider(PROVIDER_ID, "Dr. Kim", "kim@clinic.test", null, "GP", Set.of(), NOW, NOW);
    }

    private static Appointment appointment(String id, AppointmentStatus status) {
        return new Appointment(id, PROVIDER_ID, "service-1", START, START.plusSeconds(1800), status,
                "Jane", "jane@example.com", "5551234567", Map.of(), false, null, null, NOW, NOW);
    }

    @Test
    @DisplayName("겹치는 활성 예약이 없으면 저장하고 알림 작업을 남긴다")
    void reserveSaves() {
        // given
        Appointment toBook = appointment("a1", AppointmentStatus.PENDING);
        given(providerRepository.lockForBooking(PROVIDER_ID)).willReturn(Optional.of(provider()));
        given(appointmentRepository.findAll(any(StoreQuery.class))).willReturn(List.of());
        given(appointmentRepository.save(toBook)).willReturn(toBook);

        // when
        Appointment saved = guard.reserve(toBook);

        // then
        assertThat(saved).isEqualTo(toBook);
        then(appointmentNotificationPort).should().bookingCreated(toBook);
    }

    @Test
    @DisplayName("겹치는 활성 예약이 있으면 DOUBLE_BOOKING")
    void reserveRejectsOverlap() {
        // given
        given(providerRepository.lockForBooking(PROVIDER_ID)).willReturn(Optional.of(provider()));
        given(appointmentRepository.findAll(any(StoreQuery.class)))
                .willReturn(List.of(appointment("other", AppointmentStatus.CONFIRMED)));

        // when & then
        assertThatThrownBy(() -> guard.reserve(appointment("a1", AppointmentStatus.PENDING)))
                .isInstanceOf(DoubleBookingException.class)
                .satisfies(e -> assertThat(((DoubleBookingException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DOUBLE_BOOKING));
        then(appointmentRepository).should(never()).save(any());
        then(appointmentNotificationPort).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("의료진이 없으면 ProviderNotFoundException")
    void reserveRequiresProvider() {
        given(providerRepository.lockForBooking(PROVIDER_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> guard.reserve(appointment("a1", AppointmentStatus.PENDING)))
                .isInstanceOf(ProviderNotFoundException.class);
    }

    @Test
    @DisplayName("겹침 검사 조건: 같은 의료진, 활성 상태, start < end, end > start, 자기 자신 제외")
    void overlapQueryConditions() {
        // given
        TimeInterval interval = new TimeInterval(START, START.plusSeconds(1800));
        given(appointmentRepository.findAll(any(StoreQuery.class))).willReturn(List.of());
        ArgumentCaptor<StoreQuery> captor = ArgumentCaptor.forClass(StoreQuery.class);

        // when
        guard.ensureNoOverlap(PROVIDER_ID, interval, "self");

        // then
        then(appointmentRepository).should().findAll(captor.capture());
        assertThat(captor.getValue().conditions())
                .extracting(Condition::field, Condition::operator, Condition::value)
                .contains(
                        tuple("providerId", Operator.EQ, PROVIDER_ID),
                        tuple("status", Operator.IN, AppointmentStatus.ACTIVE),
                        tuple("startTime", Operator.LT, interval.end()),
                        tuple("endTime", Operator.GT, interval.start()),
                        tuple("id", Operator.NE, "self"));
    }

    @Test
    @DisplayName("자기 자신과만 겹치는 일정 변경은 성공한다")
    void rescheduleExcludesItself() {
        // given
        Appointment existing = appointment("a1", AppointmentStatus.CONFIRMED);
        TimeInterval shifted = new TimeInterval(START.plusSeconds(900), START.plusSeconds(2700));
        given(appointmentRepository.findById("a1")).willReturn(Optional.of(existing));
        given(providerRepository.lockForBooking(PROVIDER_ID)).willReturn(Optional.of(provider()));
        given(appointmentRepository.findAll(any(StoreQuery.class))).willReturn(List.of());
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        Appointment moved = guard.reschedule("a1", shifted, "Doctor unavailable", NOW);

        // then
        assertThat(moved.startTime()).isEqualTo(shifted.start());
        assertThat(moved.status()).isEqualTo(AppointmentStatus.CONFIRMED);
        then(appointmentNotificationPort).should().rescheduled(moved, "Doctor unavailable");
    }

    @Test
    @DisplayName("취소된 예약은 일정 변경할 수 없다")
    void rescheduleRejectsInactive() {
        given(appointmentRepository.findById("a1"))
                .willReturn(Optional.of(appointment("a1", AppointmentStatus.CANCELLED)));
        given(providerRepository.lockForBooking(PROVIDER_ID)).willReturn(Optional.of(provider()));

        assertThatThrownBy(() -> guard.reschedule("a1", new TimeInterval(START, START.plusSeconds(60)), null, NOW))
                .isInstanceOf(InvalidStatusTransitionException.class);
    }
}
