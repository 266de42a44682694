package personal.clinic.booking.appointment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.appointment.application.port.in.GetAvailableSlotsUseCase;
import personal.clinic.booking.appointment.application.port.out.AppointmentRepository;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.appointment.domain.model.TimeInterval;
import personal.clinic.booking.appointment.domain.model.TimeSlot;
import personal.clinic.booking.appointment.domain.service.AvailabilityResolver;
import personal.clinic.booking.catalog.application.port.in.ManageAvailabilityUseCase;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;
import personal.clinic.booking.config.ClinicProperties;
import personal.clinic.booking.store.StoreQuery;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Slot Query Service
 * 예약 가능 시간대 조회 (읽기 전용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SlotQueryService implements GetAvailableSlotsUseCase {

    private final ManageAvailabilityUseCase manageAvailabilityUseCase;
    private final AppointmentRepository appointmentRepository;
    private final AvailabilityResolver availabilityResolver;
    private final ClinicProperties clinicProperties;

    @Override
    public List<TimeSlot> getAvailableSlots(String providerId, LocalDate date, int durationMinutes) {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "providerId is required");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "date is required");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "duration must be a positive number of minutes: " + durationMinutes);
        }

        ProviderAvailability availability = manageAvailabilityUseCase.getAvailability(providerId);

        Optional<TimeInterval> window = availabilityResolver.openWindow(availability, date, clinicProperties.zoneId());
        if (window.isEmpty()) {
            return List.of();
        }

        List<TimeInterval> booked = appointmentRepository.findAll(StoreQuery.where()
                        .eq("providerId", availability.providerId())
                        .in("status", AppointmentStatus.ACTIVE)
                        .lt("startTime", window.get().end())
                        .gt("endTime", window.get().start())
                        .build())
                .stream()
                .map(Appointment::interval)
                .toList();

        List<TimeSlot> free = availabilityResolver.freeSlots(window.get(), durationMinutes, booked);
        List<TimeSlot> slots = availabilityResolver.sample(free, clinicProperties.slots().maxResults());

        log.debug("Available slots: providerId={}, date={}, duration={}, booked={}, candidates={}, returned={}",
                providerId, date, durationMinutes, booked.size(), free.size(), slots.size());
        return slots;
    }
}
