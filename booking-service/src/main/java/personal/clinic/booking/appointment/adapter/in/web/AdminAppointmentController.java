package personal.clinic.booking.appointment.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import personal.clinic.booking.appointment.adapter.in.web.dto.ActionResponse;
import personal.clinic.booking.appointment.adapter.in.web.dto.AppointmentListResponse;
import personal.clinic.booking.appointment.adapter.in.web.dto.RescheduleRequest;
import personal.clinic.booking.appointment.adapter.in.web.dto.UpdateStatusRequest;
import personal.clinic.booking.appointment.application.port.in.AppointmentSearchQuery;
import personal.clinic.booking.appointment.application.port.in.AppointmentStats;
import personal.clinic.booking.appointment.application.port.in.ManageAppointmentUseCase;
import personal.clinic.booking.appointment.application.port.in.SearchAppointmentsUseCase;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.audit.adapter.in.web.StaffActors;

import java.time.Instant;

/**
 * Admin Appointment Controller
 * 직원용 예약 관리 REST API
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/admin/appointments")
@RequiredArgsConstructor
public class AdminAppointmentController {

    private final SearchAppointmentsUseCase searchAppointmentsUseCase;
    private final ManageAppointmentUseCase manageAppointmentUseCase;

    /**
     * 예약 목록 (시작 시각 내림차순)
     * GET /api/admin/appointments?status&providerId&startDate&endDate&limit&skip
     */
    @GetMapping
    public ResponseEntity<AppointmentListResponse> getAppointments(
            @RequestParam(required = false) AppointmentStatus status,
            @RequestParam(required = false) String providerId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int skip
    ) {
        log.debug("Admin appointment search: status={}, providerId={}, startDate={}, endDate={}, limit={}, skip={}",
                status, providerId, startDate, endDate, limit, skip);

        AppointmentSearchQuery query = new AppointmentSearchQuery(status, providerId, startDate, endDate, limit, skip);
        return ResponseEntity.ok(AppointmentListResponse.from(searchAppointmentsUseCase.search(query)));
    }

    @GetMapping("/stats")
    public ResponseEntity<AppointmentStats> getStats() {
        return ResponseEntity.ok(searchAppointmentsUseCase.stats());
    }

    /**
     * 상태 변경
     * PATCH /api/admin/appointments/{appointmentId}/status
     */
    @PatchMapping("/{appointmentId}/status")
    public ResponseEntity<ActionResponse> updateStatus(
            @PathVariable String appointmentId,
            @Valid @RequestBody UpdateStatusRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Update appointment status: appointmentId={}, status={}", appointmentId, request.status());
        manageAppointmentUseCase.updateStatus(appointmentId, request.status(),
                StaffActors.from(staffEmail, httpRequest));
        return ResponseEntity.ok(ActionResponse.ok("Appointment updated"));
    }

    /**
     * 일정 변경
     * PATCH /api/admin/appointments/{appointmentId}/reschedule
     */
    @PatchMapping("/{appointmentId}/reschedule")
    public ResponseEntity<ActionResponse> reschedule(
            @PathVariable String appointmentId,
            @Valid @RequestBody RescheduleRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Reschedule appointment: appointmentId={}, newStartTime={}", appointmentId, request.newStartTime());
        manageAppointmentUseCase.reschedule(request.toCommand(appointmentId),
                StaffActors.from(staffEmail, httpRequest));
        return ResponseEntity.ok(ActionResponse.ok("Appointment rescheduled successfully"));
    }

    @PostMapping("/{appointmentId}/cancel")
    public ResponseEntity<ActionResponse> cancel(
            @PathVariable String appointmentId,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Cancel appointment: appointmentId={}", appointmentId);
        manageAppointmentUseCase.cancel(appointmentId, StaffActors.from(staffEmail, httpRequest));
        return ResponseEntity.ok(ActionResponse.ok("Appointment cancelled"));
    }
}
