package personal.clinic.booking.appointment.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import personal.clinic.booking.appointment.application.port.in.BookAppointmentCommand;
import personal.clinic.booking.appointment.application.port.out.ReminderSchedulingPort;
import personal.clinic.booking.appointment.domain.exception.ConcurrentBookingException;
import personal.clinic.booking.appointment.domain.exception.DoubleBookingException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.appointment.domain.service.BookingConflictGuard;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("AppointmentBookingService 단위 테스트")
class AppointmentBookingServiceTest {

    private static final Instant NOW = Instant.parse("2030-03-01T12:00:00Z");
    private static final Instant START = Instant.parse("2030-03-04T15:00:00Z");

    @Mock
    private BookingConflictGuard bookingConflictGuard;
    @Mock
    private ReminderSchedulingPort reminderSchedulingPort;

    private AppointmentBookingService service;

    @BeforeEach
    void setUp() {
        service = new AppointmentBookingService(bookingConflictGuard, reminderSchedulingPort,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static BookAppointmentCommand command(Instant start) {
        return new BookAppointmentCommand("provider-1", "service-1", start, start.plusSeconds(1800),
                "Jane", "Jane@Example.com", "5551234567", null);
    }

    @Test
    @DisplayName("예약 성공 시 PENDING으로 저장하고 커밋 후 리마인더 타이머를 등록한다")
    void booksPendingAndArmsReminder() {
        // given
        given(bookingConflictGuard.reserve(any(Appointment.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        Appointment booked = service.book(command(START));

        // then
        assertThat(booked.status()).isEqualTo(AppointmentStatus.PENDING);
        assertThat(booked.patientEmail()).isEqualTo("jane@example.com");
        assertThat(booked.createdAt()).isEqualTo(NOW);
        then(reminderSchedulingPort).should().schedule(booked);
    }

    @Test
    @DisplayName("과거 시각 예약은 INVALID_INPUT")
    void rejectsPastStart() {
        assertThatThrownBy(() -> service.book(command(NOW.minusSeconds(60))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
        then(bookingConflictGuard).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("Unique Index 위반은 DOUBLE_BOOKING으로 변환된다")
    void translatesUniqueViolation() {
        // given
        given(bookingConflictGuard.reserve(any(Appointment.class)))
                .willThrow(new DataIntegrityViolationException("uk_provider_start_active"));

        // when & then
        assertThatThrownBy(() -> service.book(command(START)))
                .isInstanceOf(ConcurrentBookingException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DOUBLE_BOOKING));
        then(reminderSchedulingPort).should(never()).schedule(any());
    }

    @Test
    @DisplayName("겹침 거절은 그대로 전파되고 타이머를 등록하지 않는다")
    void propagatesDoubleBooking() {
        given(bookingConflictGuard.reserve(any(Appointment.class)))
                .willThrow(new DoubleBookingException("provider-1"));

        assertThatThrownBy(() -> service.book(command(START)))
                .isInstanceOf(DoubleBookingException.class);
        then(reminderSchedulingPort).shouldHaveNoInteractions();
    }
}
