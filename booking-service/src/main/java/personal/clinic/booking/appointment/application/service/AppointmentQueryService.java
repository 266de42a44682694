package personal.clinic.booking.appointment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.appointment.application.port.in.AppointmentPage;
import personal.clinic.booking.appointment.application.port.in.AppointmentSearchQuery;
import personal.clinic.booking.appointment.application.port.in.AppointmentStats;
import personal.clinic.booking.appointment.application.port.in.GetAppointmentUseCase;
import personal.clinic.booking.appointment.application.port.in.PatientAppointmentView;
import personal.clinic.booking.appointment.application.port.in.SearchAppointmentsUseCase;
import personal.clinic.booking.appointment.application.port.out.AppointmentRepository;
import personal.clinic.booking.appointment.domain.exception.AppointmentNotFoundException;
import personal.clinic.booking.appointment.domain.model.Appointment;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.catalog.application.port.in.ManageProvidersUseCase;
import personal.clinic.booking.catalog.application.port.in.ManageServicesUseCase;
import personal.clinic.booking.catalog.domain.model.ClinicService;
import personal.clinic.booking.catalog.domain.model.Provider;
import personal.clinic.booking.store.StoreQuery;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Appointment Query Service
 * 예약 단건/환자 이력/직원용 목록 및 통계 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AppointmentQueryService implements GetAppointmentUseCase, SearchAppointmentsUseCase {

    private static final String UNKNOWN_SERVICE = "Unknown Service";
    private static final String UNKNOWN_PROVIDER = "Unknown Provider";

    private final AppointmentRepository appointmentRepository;
    private final ManageServicesUseCase manageServicesUseCase;
    private final ManageProvidersUseCase manageProvidersUseCase;

    @Override
    public Appointment getAppointment(String appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
    }

    @Override
    public List<PatientAppointmentView> getPatientHistory(String email) {
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Email parameter is required");
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);

        List<Appointment> appointments = appointmentRepository.findAll(StoreQuery.where()
                .eq("patientEmail", normalizedEmail)
                .orderByDesc("startTime")
                .build());
        log.debug("Patient history: email={}, count={}", normalizedEmail, appointments.size());

        // 같은 서비스/의료진은 한 번만 조회
        Map<String, String> serviceNames = new HashMap<>();
        Map<String, String> providerNames = new HashMap<>();

        return appointments.stream()
                .map(appointment -> new PatientAppointmentView(
                        appointment,
                        serviceNames.computeIfAbsent(appointment.serviceId(), id -> manageServicesUseCase
                                .findService(id).map(ClinicService::name).orElse(UNKNOWN_SERVICE)),
                        providerNames.computeIfAbsent(appointment.providerId(), id -> manageProvidersUseCase
                                .findProvider(id).map(Provider::name).orElse(UNKNOWN_PROVIDER))))
                .toList();
    }

    @Override
    public AppointmentPage search(AppointmentSearchQuery query) {
        StoreQuery.Builder filter = filter(query);
        List<Appointment> appointments = appointmentRepository.findAll(filter(query)
                .orderByDesc("startTime")
                .limit(query.limit())
                .skip(query.skip())
                .build());
        long total = appointmentRepository.count(filter.build());
        return new AppointmentPage(appointments, total, query.limit(), query.skip());
    }

    @Override
    public AppointmentStats stats() {
        return new AppointmentStats(
                appointmentRepository.count(StoreQuery.where().build()),
                appointmentRepository.count(StoreQuery.where().eq("status", AppointmentStatus.PENDING).build()),
                appointmentRepository.count(StoreQuery.where().eq("status", AppointmentStatus.CONFIRMED).build()),
                appointmentRepository.countDistinctPatients());
    }

    private StoreQuery.Builder filter(AppointmentSearchQuery query) {
        String providerId = query.providerId() == null || query.providerId().isBlank()
                ? null
                : query.providerId().trim();
        return StoreQuery.where()
                .eq("status", query.status())
                .eq("providerId", providerId)
                .gte("startTime", query.startDate())
                .lte("startTime", query.endDate());
    }
}
