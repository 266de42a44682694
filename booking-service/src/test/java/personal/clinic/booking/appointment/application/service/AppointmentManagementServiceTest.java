package personal.clinic.booking.appointment.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.booking.appointment.application.port.in.RescheduleCommand;
import personal.clinic.booking.appointment.application.port.out.ReminderSchedulingPort;
import personal.clinic.booking.appointment.domain.exception.AppointmentNotFoundException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.appointment.domain.service.AppointmentStatusManager;
import personal.clinic.booking.appointment.domain.service.AppointmentStatusManager.StatusChange;
import personal.clinic.booking.appointment.domain.service.BookingConflictGuard;
import personal.clinic.booking.audit.application.port.in.RecordAuditUseCase;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.AuditStatus;
import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.catalog.application.port.in.ManageServicesUseCase;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.inOrder;

@ExtendWith(MockitoExtension.class)
@DisplayName("AppointmentManagementService 단위 테스트")
class AppointmentManagementServiceTest {

    private static final Instant NOW = Instant.parse("2030-03-01T12:00:00Z");
    private static final Instant START = Instant.parse("2030-03-04T15:00:00Z");
    private static final StaffActor ACTOR = new StaffActor("staff@clinic.test", "127.0.0.1", "junit");

    @Mock
    private AppointmentStatusManager appointmentStatusManager;
    @Mock
    private BookingConflictGuard bookingConflictGuard;
    @Mock
    private ReminderSchedulingPort reminderSchedulingPort;
    @Mock
    private RecordAuditUseCase recordAuditUseCase;
    @Mock
    private ManageServicesUseCase manageServicesUseCase;

    private AppointmentManagementService service;

    @BeforeEach
    void setUp() {
        service = new AppointmentManagementService(appointmentStatusManager, bookingConflictGuard,
                reminderSchedulingPort, recordAuditUseCase, manageServicesUseCase, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Appointment appointment(AppointmentStatus status, Instant start) {
        return new Appointment("a1", "provider-1", "service-1", start, start.plusSeconds(1800), status,
                "Jane", "jane@example.com", "5551234567", Map.of(), false, null, null, NOW, NOW);
    }

    @Test
    @DisplayName("취소하면 리마인더 타이머를 해제하고 감사 로그를 남긴다")
    void cancelClearsTimers() {
        // given
        Appointment before = appointment(AppointmentStatus.CONFIRMED, START);
        Appointment after = appointment(AppointmentStatus.CANCELLED, START);
        given(appointmentStatusManager.changeStatus("a1", AppointmentStatus.CANCELLED, NOW))
                .willReturn(new StatusChange(before, after));
        given(manageServicesUseCase.findService("service-1")).willReturn(Optional.empty());
        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);

        // when
        Appointment result = service.cancel("a1", ACTOR);

        // then
        assertThat(result.status()).isEqualTo(AppointmentStatus.CANCELLED);
        then(reminderSchedulingPort).should().cancel("a1");
        then(recordAuditUseCase).should().record(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo("cancel");
        assertThat(captor.getValue().entityName()).startsWith("Jane - Appointment");
        assertThat(captor.getValue().changes()).containsKey("status");
    }

    @Test
    @DisplayName("확정은 타이머를 유지한다")
    void confirmKeepsTimers() {
        given(appointmentStatusManager.changeStatus("a1", AppointmentStatus.CONFIRMED, NOW))
                .willReturn(new StatusChange(appointment(AppointmentStatus.PENDING, START),
                        appointment(AppointmentStatus.CONFIRMED, START)));

        service.updateStatus("a1", AppointmentStatus.CONFIRMED, ACTOR);

        then(reminderSchedulingPort).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("실패하면 FAILURE 감사 로그를 남기고 예외를 다시 던진다")
    void failureIsAudited() {
        // given
        given(appointmentStatusManager.changeStatus(eq("missing"), any(), any()))
                .willThrow(new AppointmentNotFoundException("missing"));
        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);

        // when & then
        assertThatThrownBy(() -> service.updateStatus("missing", AppointmentStatus.CONFIRMED, ACTOR))
                .isInstanceOf(AppointmentNotFoundException.class);
        then(recordAuditUseCase).should().recordFailure(captor.capture());
        assertThat(captor.getValue().status()).isEqualTo(AuditStatus.FAILURE);
        assertThat(captor.getValue().entityId()).isEqualTo("missing");
    }

    @Test
    @DisplayName("일정 변경 후 기존 타이머를 해제하고 새 시각으로 재등록한다")
    void rescheduleRearmsTimer() {
        // given
        Instant newStart = START.plusSeconds(86_400);
        Appointment moved = appointment(AppointmentStatus.CONFIRMED, newStart);
        given(bookingConflictGuard.reschedule(eq("a1"), any(TimeInterval.class), eq("Doctor out"), eq(NOW)))
                .willReturn(moved);
        given(manageServicesUseCase.findService(anyString())).willReturn(Optional.empty());

        // when
        service.reschedule(new RescheduleCommand("a1", newStart, newStart.plusSeconds(1800), "Doctor out"), ACTOR);

        // then
        var order = inOrder(reminderSchedulingPort);
        order.verify(reminderSchedulingPort).cancel("a1");
        order.verify(reminderSchedulingPort).schedule(moved);
    }
}
