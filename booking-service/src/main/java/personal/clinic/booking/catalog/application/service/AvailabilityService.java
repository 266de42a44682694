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
import personal.clinic.booking.catalog.application.port.in.ManageAvailabilityUseCase;
import personal.clinic.booking.catalog.application.port.in.ReplaceAvailabilityCommand;
import personal.clinic.booking.catalog.application.port.out.ProviderAvailabilityRepository;
import personal.clinic.booking.catalog.application.port.out.ProviderRepository;
import personal.clinic.booking.catalog.domain.exception.ProviderAvailabilityNotFoundException;
import personal.clinic.booking.catalog.domain.exception.ProviderNotFoundException;
import personal.clinic.booking.catalog.domain.model.BusinessHours;
import personal.clinic.booking.catalog.domain.model.Provider;
import personal.clinic.booking.catalog.domain.model.ProviderAvailability;
import personal.clinic.common.exception.BusinessException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Availability Service
 * 의료진 근무 시간 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService implements ManageAvailabilityUseCase {

    private final ProviderRepository providerRepository;
    private final ProviderAvailabilityRepository providerAvailabilityRepository;
    private final RecordAuditUseCase recordAuditUseCase;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public ProviderAvailability getAvailability(String providerId) {
        return providerAvailabilityRepository.findByProviderId(providerId)
                .orElseThrow(() -> new ProviderAvailabilityNotFoundException(providerId));
    }

    @Override
    @Transactional
    public ProviderAvailability replaceAvailability(String providerId, ReplaceAvailabilityCommand command,
                                                    StaffActor actor) {
        try {
            Provider provider = providerRepository.findById(providerId)
                    .orElseThrow(() -> new ProviderNotFoundException(providerId));

            Map<String, Object> before = providerAvailabilityRepository.findByProviderId(provider.id())
                    .map(AvailabilityService::snapshot)
                    .orElse(Map.of());

            ProviderAvailability saved = providerAvailabilityRepository.save(new ProviderAvailability(
                    null, provider.id(), command.businessHours(), command.blockedDates()));

            recordAuditUseCase.record(AuditLog.success(actor, "update", AuditEntityType.AVAILABILITY,
                    provider.id(), provider.name(), AuditChanges.detect(before, snapshot(saved)),
                    Instant.now(clock)));
            log.info("Availability replaced: providerId={}, days={}, blockedDates={}",
                    provider.id(), saved.businessHours().size(), saved.blockedDates().size());
            return saved;
        } catch (BusinessException e) {
            log.warn("Availability update failed: providerId={}, reason={}", providerId, e.getMessage());
            recordAuditUseCase.recordFailure(AuditLog.failure(actor, "update",
                    AuditEntityType.AVAILABILITY, providerId, e.getMessage(), Instant.now(clock)));
            throw e;
        }
    }

    private static Map<String, Object> snapshot(ProviderAvailability availability) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (BusinessHours hours : availability.businessHours()) {
            values.put("day" + hours.dayOfWeek(), hours.open()
                    ? hours.startTime() + "-" + hours.endTime()
                    : "closed");
        }
        values.put("blockedDates", availability.blockedDates().stream().sorted().map(Object::toString).toList());
        return values;
    }
}
