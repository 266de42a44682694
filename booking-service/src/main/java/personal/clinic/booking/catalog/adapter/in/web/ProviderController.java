package personal.clinic.booking.catalog.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.clinic.booking.audit.adapter.in.web.StaffActors;
import personal.clinic.booking.catalog.adapter.in.web.dto.AvailabilityRequest;
import personal.clinic.booking.catalog.adapter.in.web.dto.AvailabilityResponse;
import personal.clinic.booking.catalog.adapter.in.web.dto.ProviderRequest;
import personal.clinic.booking.catalog.adapter.in.web.dto.ProviderResponse;
import personal.clinic.booking.catalog.application.port.in.ManageAvailabilityUseCase;
import personal.clinic.booking.catalog.application.port.in.ManageProvidersUseCase;

import java.util.List;
import java.util.Map;

/**
 * Provider API Controller
 * 의료진 및 근무 시간 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ManageProvidersUseCase manageProvidersUseCase;
    private final ManageAvailabilityUseCase manageAvailabilityUseCase;

    /**
     * 의료진 목록 조회
     * GET /api/providers?serviceId={serviceId}
     */
    @GetMapping
    public ResponseEntity<List<ProviderResponse>> getProviders(
            @RequestParam(required = false) String serviceId) {
        List<ProviderResponse> response = manageProvidersUseCase.getProviders(serviceId).stream()
                .map(ProviderResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{providerId}")
    public ResponseEntity<ProviderResponse> getProvider(@PathVariable String providerId) {
        return ResponseEntity.ok(ProviderResponse.from(manageProvidersUseCase.getProvider(providerId)));
    }

    @PostMapping
    public ResponseEntity<ProviderResponse> createProvider(
            @Valid @RequestBody ProviderRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Create provider: name={}", request.name());
        ProviderResponse response = ProviderResponse.from(manageProvidersUseCase.createProvider(
                request.toCommand(), StaffActors.from(staffEmail, httpRequest)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{providerId}")
    public ResponseEntity<ProviderResponse> updateProvider(
            @PathVariable String providerId,
            @Valid @RequestBody ProviderRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Update provider: providerId={}", providerId);
        return ResponseEntity.ok(ProviderResponse.from(manageProvidersUseCase.updateProvider(
                providerId, request.toCommand(), StaffActors.from(staffEmail, httpRequest))));
    }

    @DeleteMapping("/{providerId}")
    public ResponseEntity<Map<String, Object>> deleteProvider(
            @PathVariable String providerId,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Delete provider: providerId={}", providerId);
        manageProvidersUseCase.deleteProvider(providerId, StaffActors.from(staffEmail, httpRequest));
        return ResponseEntity.ok(Map.of("success", true));
    }

    /**
     * 근무 시간 조회
     * GET /api/providers/{providerId}/availability
     */
    @GetMapping("/{providerId}/availability")
    public ResponseEntity<AvailabilityResponse> getAvailability(@PathVariable String providerId) {
        return ResponseEntity.ok(AvailabilityResponse.from(manageAvailabilityUseCase.getAvailability(providerId)));
    }

    @PutMapping("/{providerId}/availability")
    public ResponseEntity<AvailabilityResponse> replaceAvailability(
            @PathVariable String providerId,
            @Valid @RequestBody AvailabilityRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Replace availability: providerId={}", providerId);
        return ResponseEntity.ok(AvailabilityResponse.from(manageAvailabilityUseCase.replaceAvailability(
                providerId, request.toCommand(), StaffActors.from(staffEmail, httpRequest))));
    }
}
