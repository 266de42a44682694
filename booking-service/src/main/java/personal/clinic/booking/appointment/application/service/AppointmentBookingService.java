package personal.clinic.booking.appointment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import personal.clinic.booking.appointment.application.port.in.BookAppointmentCommand;
import personal.clinic.booking.appointment.application.port.in.BookAppointmentUseCase;
import personal.clinic.booking.appointment.application.port.out.ReminderSchedulingPort;
import personal.clinic.booking.appointment.domain.exception.ConcurrentBookingException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.appointment.domain.service.BookingConflictGuard;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Clock;
import java.time.Instant;

/**
 * Appointment Booking Service
 * 트랜잭션은 BookingConflictGuard에 위임하고, 커밋 후 리마인더 타이머를 등록한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentBookingService implements BookAppointmentUseCase {

    private final BookingConflictGuard bookingConflictGuard;
    private final ReminderSchedulingPort reminderSchedulingPort;
    private final Clock clock;

    @Override
    public Appointment book(BookAppointmentCommand command) {
        log.info("Booking appointment: providerId={}, serviceId={}, start={}, end={}",
                command.providerId(), command.serviceId(), command.startTime(), command.endTime());

        Instant now = Instant.now(clock);
        if (command.startTime().isBefore(now)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be in the past");
        }

        Appointment appointment = Appointment.create(
                command.providerId(),
                command.serviceId(),
                new TimeInterval(command.startTime(), command.endTime()),
                command.patientName(),
                command.patientEmail(),
                command.patientPhone(),
                command.customFieldValues(),
                now);

        Appointment saved;
        try {
            saved = bookingConflictGuard.reserve(appointment);
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            // 2차 방어: Unique Index 위반 또는 락 대기 시간 초과
            log.warn("Concurrent booking detected: providerId={}, start={}",
                    command.providerId(), command.startTime(), e);
            throw new ConcurrentBookingException(e);
        }

        // 커밋 후 타이머 등록
        reminderSchedulingPort.schedule(saved);

        log.info("Appointment booked: appointmentId={}, providerId={}, start={}",
                saved.id(), saved.providerId(), saved.startTime());
        return saved;
    }
}
