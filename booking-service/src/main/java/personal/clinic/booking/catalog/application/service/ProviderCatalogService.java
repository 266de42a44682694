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
import personal.clinic.booking.catalog.application.port.in.ManageProvidersUseCase;
import personal.clinic.booking.catalog.application.port.in.SaveProviderCommand;
import personal.clinic.booking.catalog.application.port.out.ProviderAvailabilityRepository;
import personal.clinic.booking.catalog.application.port.out.ProviderRepository;
import personal.clinic.booking.catalog.domain.exception.ProviderNotFoundException;
import personal.clinic.booking.catalog.domain.model.Provider;
import personal.clinic.common.exception.BusinessException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider Catalog Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderCatalogService implements ManageProvidersUseCase {

    private final ProviderRepository providerRepository;
    private final ProviderAvailabilityRepository providerAvailabilityRepository;
    private final RecordAuditUseCase recordAuditUseCase;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<Provider> getProviders(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) {
            return providerRepository.findAll();
        }
        return providerRepository.findByServiceId(serviceId.trim());
    }

    @Override
    @Transactional(readOnly = true)
    public Provider getProvider(String providerId) {
        return providerRepository.findById(providerId)
                .orElseThrow(() -> new ProviderNotFoundException(providerId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Provider> findProvider(String providerId) {
        return providerRepository.findById(providerId);
    }

    @Override
    @Transactional
    public Provider createProvider(SaveProviderCommand command, StaffActor actor) {
        try {
            Instant now = Instant.now(clock);
            Provider saved = providerRepository.save(Provider.create(
                    command.name(), command.email(), command.phone(), command.speciality(),
                    command.serviceIds(), now));

            recordAuditUseCase.record(AuditLog.success(actor, "create", AuditEntityType.PROVIDER,
                    saved.id(), saved.name(), AuditChanges.detect(Map.of(), snapshot(saved)), now));
            log.info("Provider created: providerId={}, name={}", saved.id(), saved.name());
            return saved;
        } catch (BusinessException e) {
            recordFailure(actor, "create", null, e);
            throw e;
        }
    }

    @Override
    @Transactional
    public Provider updateProvider(String providerId, SaveProviderCommand command, StaffActor actor) {
        try {
            Provider existing = getProvider(providerId);
            Instant now = Instant.now(clock);
            Provider saved = providerRepository.save(existing.update(
                    command.name(), command.email(), command.phone(), command.speciality(),
                    command.serviceIds(), now));

            recordAuditUseCase.record(AuditLog.success(actor, "update", AuditEntityType.PROVIDER,
                    saved.id(), saved.name(), AuditChanges.detect(snapshot(existing), snapshot(saved)), now));
            log.info("Provider updated: providerId={}", saved.id());
            return saved;
        } catch (BusinessException e) {
            recordFailure(actor, "update", providerId, e);
            throw e;
        }
    }

    @Override
    @Transactional
    public void deleteProvider(String providerId, StaffActor actor) {
        try {
            Provider existing = getProvider(providerId);
            providerAvailabilityRepository.deleteByProviderId(existing.id());
            providerRepository.deleteById(existing.id());

            recordAuditUseCase.record(AuditLog.success(actor, "delete", AuditEntityType.PROVIDER,
                    existing.id(), existing.name(), AuditChanges.detect(snapshot(existing), Map.of()),
                    Instant.now(clock)));
            log.info("Provider deleted: providerId={}", existing.id());
        } catch (BusinessException e) {
            recordFailure(actor, "delete", providerId, e);
            throw e;
        }
    }

    private void recordFailure(StaffActor actor, String action, String providerId, BusinessException e) {
        log.warn("Provider operation failed: action={}, providerId={}, reason={}", action, providerId, e.getMessage());
        recordAuditUseCase.recordFailure(AuditLog.failure(actor, action, AuditEntityType.PROVIDER, providerId,
                e.getMessage(), Instant.now(clock)));
    }

    private static Map<String, Object> snapshot(Provider provider) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", provider.name());
        values.put("email", provider.email());
        values.put("phone", provider.phone());
        values.put("speciality", provider.speciality());
        values.put("serviceIds", provider.serviceIds().stream().sorted().toList());
        return values;
    }
}
