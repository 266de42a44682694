package personal.clinic.booking.appointment.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.appointment.application.port.out.AppointmentNotificationPort;
import personal.clinic.booking.appointment.application.port.out.AppointmentRepository;
import personal.clinic.booking.appointment.domain.exception.AppointmentNotFoundException;
import personal.clinic.booking.appointment.domain.exception.DoubleBookingException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.catalog.application.port.out.ProviderRepository;
import personal.clinic.booking.catalog.domain.exception.ProviderNotFoundException;
import personal.clinic.booking.catalog.domain.model.Provider;
import personal.clinic.booking.store.StoreQuery;

import java.time.Instant;
import java.util.List;

/**
 * Booking Conflict Guard (Domain Service)
 * 겹침 검사와 저장을 하나의 트랜잭션에서 수행한다.
 *
 * 1차 방어: 의료진 행 비관적 락으로 같은 의료진의 예약 쓰기를 직렬화
 * 2차 방어: (provider_id, start_time, active_slot) Unique Index
 * 알림 작업(Outbox)도 같은 트랜잭션에서 저장
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingConflictGuard {

    private final ProviderRepository providerRepository;
    private final AppointmentRepository appointmentRepository;
    private final AppointmentNotificationPort appointmentNotificationPort;

    /**
     * 신규 예약 저장
     *
     * @throws ProviderNotFoundException 의료진이 없을 때
     * @throws DoubleBookingException    활성 예약과 겹칠 때
     */
    @Transactional
    public Appointment reserve(Appointment appointment) {
        Provider provider = lockProvider(appointment.providerId());

        // 잠긴 의료진의 정규화된 식별자로 저장
        Appointment toSave = provider.id().equals(appointment.providerId())
                ? appointment
                : withProvider(appointment, provider.id());

        ensureNoOverlap(toSave.providerId(), toSave.interval(), null);

        Appointment saved = appointmentRepository.save(toSave);
        appointmentNotificationPort.bookingCreated(saved);
        return saved;
    }

    /**
     * 일정 변경 저장 (자기 자신은 겹침 검사에서 제외)
     *
     * @throws AppointmentNotFoundException 예약이 없을 때
     * @throws DoubleBookingException       다른 활성 예약과 겹칠 때
     */
    @Transactional
    public Appointment reschedule(String appointmentId, TimeInterval newInterval, String reason, Instant now) {
        Appointment existing = appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));

        lockProvider(existing.providerId());

        Appointment moved = existing.reschedule(newInterval, reason, now);
        ensureNoOverlap(moved.providerId(), moved.interval(), moved.id());

        Appointment saved = appointmentRepository.save(moved);
        appointmentNotificationPort.rescheduled(saved, reason);
        return saved;
    }

    /**
     * 같은 의료진의 활성 예약 중 [start, end)와 겹치는 예약이 있으면 예외
     * 겹침 조건: existing.start < new.end AND existing.end > new.start
     */
    public void ensureNoOverlap(String providerId, TimeInterval interval, String excludeAppointmentId) {
        List<Appointment> overlapping = appointmentRepository.findAll(StoreQuery.where()
                .eq("providerId", providerId)
                .in("status", AppointmentStatus.ACTIVE)
                .lt("startTime", interval.end())
                .gt("endTime", interval.start())
                .ne("id", excludeAppointmentId)
                .limit(1)
                .build());

        if (!overlapping.isEmpty()) {
            log.warn("Double booking rejected: providerId={}, start={}, end={}, conflictWith={}",
                    providerId, interval.start(), interval.end(), overlapping.get(0).id());
            throw new DoubleBookingException(providerId);
        }
    }

    private Provider lockProvider(String providerId) {
        return providerRepository.lockForBooking(providerId)
                .orElseThrow(() -> new ProviderNotFoundException(providerId));
    }

    private static Appointment withProvider(Appointment appointment, String providerId) {
        return new Appointment(appointment.id(), providerId, appointment.serviceId(),
                appointment.startTime(), appointment.endTime(), appointment.status(),
                appointment.patientName(), appointment.patientEmail(), appointment.patientPhone(),
                appointment.customFieldValues(), appointment.reminderSent(), appointment.reminderSentAt(),
                appointment.rescheduleReason(), appointment.createdAt(), appointment.updatedAt());
    }
}
