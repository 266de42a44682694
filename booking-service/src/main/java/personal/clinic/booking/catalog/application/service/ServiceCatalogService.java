package personal.clinic.booking.catalog.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.booking.audit.application.port.in.RecordAuditUseCase;
import personal.clinic.booking.audit.domain.model.AuditChanges;
import personal.clinic.booking.audit.domain.model.AuditEntityType;
import personal.clinic.booking.audit.domain.model.AuditLog;
import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.catalog.application.port.in.ManageServicesUseCase;
import personal.clinic.booking.catalog.application.port.in.SaveServiceCommand;
import personal.clinic.booking.catalog.application.port.out.ClinicServiceRepository;
import personal.clinic.booking.catalog.domain.exception.ServiceNotFoundException;
import personal.clinic.booking.catalog.domain.model.ClinicService;
import personal.clinic.common.exception.BusinessException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service Catalog Service
 * 진료 서비스 관리 + 감사 로그 기록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceCatalogService implements ManageServicesUseCase {

    private final ClinicServiceRepository clinicServiceRepository;
    private final RecordAuditUseCase recordAuditUseCase;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<ClinicService> getServices() {
        return clinicServiceRepository.findAll();
    }

    @Override
    @Transactional(readOnly = true)
    public ClinicService getService(String serviceId) {
        return clinicServiceRepository.findById(serviceId)
                .orElseThrow(() -> new ServiceNotFoundException(serviceId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClinicService> findService(String serviceId) {
        return clinicServiceRepository.findById(serviceId);
    }

    @Override
    @Transactional
    public ClinicService createService(SaveServiceCommand command, StaffActor actor) {
        try {
            Instant now = Instant.now(clock);
            ClinicService saved = clinicServiceRepository.save(ClinicService.create(
                    command.name(), command.description(), command.duration(),
                    command.providerIds(), command.customFields(), now));

            recordAuditUseCase.record(AuditLog.success(actor, "create", AuditEntityType.SERVICE,
                    saved.id(), saved.name(), AuditChanges.detect(Map.of(), snapshot(saved)), now));
            log.info("Service created: serviceId={}, name={}", saved.id(), saved.name());
            return saved;
        } catch (BusinessException e) {
            recordFailure(actor, "create", null, e);
            throw e;
        }
    }

    @Override
    @Transactional
    public ClinicService updateService(String serviceId, SaveServiceCommand command, StaffActor actor) {
        try {
            ClinicService existing = getService(serviceId);
            Instant now = Instant.now(clock);
            ClinicService saved = clinicServiceRepository.save(existing.update(
                    command.name(), command.description(), command.duration(),
                    command.providerIds(), command.customFields(), now));

            recordAuditUseCase.record(AuditLog.success(actor, "update", AuditEntityType.SERVICE,
                    saved.id(), saved.name(), AuditChanges.detect(snapshot(existing), snapshot(saved)), now));
            log.info("Service updated: serviceId={}", saved.id());
            return saved;
        } catch (BusinessException e) {
            recordFailure(actor, "update", serviceId, e);
            throw e;
        }
    }

    @Override
    @Transactional
    public void deleteService(String serviceId, StaffActor actor) {
        try {
            ClinicService existing = getService(serviceId);
            clinicServiceRepository.deleteById(existing.id());

            recordAuditUseCase.record(AuditLog.success(actor, "delete", AuditEntityType.SERVICE,
                    existing.id(), existing.name(), AuditChanges.detect(snapshot(existing), Map.of()),
                    Instant.now(clock)));
            log.info("Service deleted: serviceId={}", existing.id());
        } catch (BusinessException e) {
            recordFailure(actor, "delete", serviceId, e);
            throw e;
        }
    }

    private void recordFailure(StaffActor actor, String action, String serviceId, BusinessException e) {
        log.warn("Service operation failed: action={}, serviceId={}, reason={}", action, serviceId, e.getMessage());
        recordAuditUseCase.recordFailure(AuditLog.failure(actor, action, AuditEntityType.SERVICE, serviceId,
                e.getMessage(), Instant.now(clock)));
    }

    private static Map<String, Object> snapshot(ClinicService service) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", service.name());
        values.put("description", service.description());
        values.put("duration", service.duration());
        values.put("providerIds", service.providerIds().stream().sorted().toList());
        values.put("customFields", service.customFields().stream().map(field -> field.name()).toList());
        return values;
    }
}
