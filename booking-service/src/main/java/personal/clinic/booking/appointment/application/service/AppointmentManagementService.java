package personal.clinic.booking.appointment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import personal.clinic.booking.appointment.application.port.in.ManageAppointmentUseCase;
import personal.clinic.booking.appointment.application.port.in.RescheduleCommand;
import personal.clinic.booking.appointment.application.port.out.ReminderSchedulingPort;
import personal.clinic.booking.appointment.domain.exception.ConcurrentBookingException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.appointment.domain.service.AppointmentStatusManager;
import personal.clinic.booking.appointment.domain.service.AppointmentStatusManager.StatusChange;
import personal.clinic.booking.appointment.domain.service.BookingConflictGuard;
import personal.clinic.booking.audit.application.port.in.RecordAuditUseCase;
import personal.clinic.booking.audit.domain.model.AuditChanges;
import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.catalog.application.port.in.ManageServicesUseCase;
import personal.clinic.booking.catalog.domain.model.ClinicService;
import personal.clinic.common.exception.BusinessException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appointment Management Service
 * 직원용 예약 변경 오케스트레이션
 *
 * 1. 트랜잭션 (상태 저장 + 알림 Outbox) - 도메인 서비스 위임
 * 2. 커밋 후 리마인더 타이머 해제/재등록
 * 3. 감사 로그 (실패 시 별도 트랜잭션)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentManagementService implements ManageAppointmentUseCase {

    private static final String DEFAULT_SERVICE_NAME = "Appointment";

    private final AppointmentStatusManager appointmentStatusManager;
    private final BookingConflictGuard bookingConflictGuard;
    private final ReminderSchedulingPort reminderSchedulingPort;
    private final RecordAuditUseCase recordAuditUseCase;
    private final ManageServicesUseCase manageServicesUseCase;
    private final Clock clock;

    @Override
    public Appointment updateStatus(String appointmentId, AppointmentStatus newStatus, StaffActor actor) {
        return changeStatus(appointmentId, newStatus, actor, "updateStatus");
    }

    @Override
    public Appointment cancel(String appointmentId, StaffActor actor) {
        return changeStatus(appointmentId, AppointmentStatus.CANCELLED, actor, "cancel");
    }

    @Override
    public Appointment reschedule(RescheduleCommand command, StaffActor actor) {
        log.info("Rescheduling appointment: appointmentId={}, newStart={}, newEnd={}",
                command.appointmentId(), command.newStartTime(), command.newEndTime());
        try {
            Instant now = Instant.now(clock);
            Appointment saved;
            try {
                saved = bookingConflictGuard.reschedule(command.appointmentId(),
                        new TimeInterval(command.newStartTime(), command.newEndTime()), command.reason(), now);
            } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
                log.warn("Concurrent reschedule detected: appointmentId={}", command.appointmentId(), e);
                throw new ConcurrentBookingException(e);
            }

            // 기존 타이머 해제 후 새 시각으로 재등록
            reminderSchedulingPort.cancel(saved.id());
            reminderSchedulingPort.schedule(saved);

            Map<String, Object> after = new LinkedHashMap<>();
            after.put("startTime", saved.startTime().toString());
            after.put("endTime", saved.endTime().toString());
            after.put("rescheduleReason", saved.rescheduleReason());
            recordAuditUseCase.record(AuditLog.success(actor, "reschedule", AuditEntityType.APPOINTMENT,
                    saved.id(), entityName(saved), AuditChanges.detect(Map.of(), after), now));

            log.info("Appointment rescheduled: appointmentId={}, start={}", saved.id(), saved.startTime());
            return saved;
        } catch (BusinessException e) {
            recordFailure(actor, "reschedule", command.appointmentId(), e);
            throw e;
        }
    }

    private Appointment changeStatus(String appointmentId, AppointmentStatus newStatus, StaffActor actor,
                                     String action) {
        log.info("Changing appointment status: appointmentId={}, newStatus={}", appointmentId, newStatus.value());
        try {
            Instant now = Instant.now(clock);
            StatusChange change = appointmentStatusManager.changeStatus(appointmentId, newStatus, now);
            Appointment updated = change.after();

            if (!updated.isActive()) {
                reminderSchedulingPort.cancel(updated.id());
            }

            recordAuditUseCase.record(AuditLog.success(actor, action, AuditEntityType.APPOINTMENT,
                    updated.id(), entityName(updated),
                    AuditChanges.single("status", change.before().status().value(), updated.status().value()),
                    now));
            return updated;
        } catch (BusinessException e) {
            recordFailure(actor, action, appointmentId, e);
            throw e;
        }
    }

    private void recordFailure(StaffActor actor, String action, String appointmentId, BusinessException e) {
        log.warn("Appointment operation failed: action={}, appointmentId={}, reason={}",
                action, appointmentId, e.getMessage());
        recordAuditUseCase.recordFailure(AuditLog.failure(actor, action, AuditEntityType.APPOINTMENT,
                appointmentId, e.getMessage(), Instant.now(clock)));
    }

    private String entityName(Appointment appointment) {
        String serviceName = manageServicesUseCase.findService(appointment.serviceId())
                .map(ClinicService::name)
                .orElse(DEFAULT_SERVICE_NAME);
        return appointment.patientName() + " - " + serviceName + " (" + appointment.startTime() + ")";
    }
}
