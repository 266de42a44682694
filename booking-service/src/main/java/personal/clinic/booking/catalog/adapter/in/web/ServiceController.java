package personal.clinic.booking.catalog.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.clinic.booking.audit.adapter.in.web.StaffActors;
import personal.clinic.booking.catalog.adapter.in.web.dto.ServiceRequest;
import personal.clinic.booking.catalog.adapter.in.web.dto.ServiceResponse;
import personal.clinic.booking.catalog.application.port.in.ManageServicesUseCase;

import java.util.List;
import java.util.Map;

/**
 * Service API Controller
 * 진료 서비스 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/services")
@RequiredArgsConstructor
public class ServiceController {

    private final ManageServicesUseCase manageServicesUseCase;

    @GetMapping
    public ResponseEntity<List<ServiceResponse>> getServices() {
        List<ServiceResponse> response = manageServicesUseCase.getServices().stream()
                .map(ServiceResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{serviceId}")
    public ResponseEntity<ServiceResponse> getService(@PathVariable String serviceId) {
        return ResponseEntity.ok(ServiceResponse.from(manageServicesUseCase.getService(serviceId)));
    }

    /**
     * 서비스 생성
     * POST /api/services
     */
    @PostMapping
    public ResponseEntity<ServiceResponse> createService(
            @Valid @RequestBody ServiceRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Create service: name={}", request.name());
        ServiceResponse response = ServiceResponse.from(manageServicesUseCase.createService(
                request.toCommand(), StaffActors.from(staffEmail, httpRequest)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{serviceId}")
    public ResponseEntity<ServiceResponse> updateService(
            @PathVariable String serviceId,
            @Valid @RequestBody ServiceRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Update service: serviceId={}", serviceId);
        return ResponseEntity.ok(ServiceResponse.from(manageServicesUseCase.updateService(
                serviceId, request.toCommand(), StaffActors.from(staffEmail, httpRequest))));
    }

    @DeleteMapping("/{serviceId}")
    public ResponseEntity<Map<String, Object>> deleteService(
            @PathVariable String serviceId,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Delete service: serviceId={}", serviceId);
        manageServicesUseCase.deleteService(serviceId, StaffActors.from(staffEmail, httpRequest));
        return ResponseEntity.ok(Map.of("success", true));
    }
}
