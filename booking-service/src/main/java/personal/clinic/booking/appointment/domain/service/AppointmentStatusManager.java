package personal.clinic.booking.appointment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.appointment.application.port.out.AppointmentNotificationPort;
import personal.clinic.booking.appointment.application.port.out.AppointmentRepository;
import personal.clinic.booking.appointment.domain.exception.AppointmentNotFoundException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;

import java.time.Instant;

/**
 * 예약 상태 변경 트랜잭션 (상태 저장 + 알림 Outbox)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentStatusManager {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentNotificationPort appointmentNotificationPort;

    /**
     * @return 변경 전/후 예약
     */
    @Transactional
    public StatusChange changeStatus(String appointmentId, AppointmentStatus newStatus, Instant now) {
        Appointment existing = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));

        Appointment updated = appointmentRepository.save(existing.changeStatus(newStatus, now));
        appointmentNotificationPort.statusChanged(updated);

        log.info("Appointment status changed: appointmentId={}, {} -> {}",
                updated.id(), existing.status().value(), updated.status().value());
        return new StatusChange(existing, updated);
    }

    public record StatusChange(Appointment before, Appointment after) {
    }
}
