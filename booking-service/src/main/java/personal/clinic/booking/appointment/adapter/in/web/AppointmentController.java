package personal.clinic.booking.appointment.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.clinic.booking.appointment.adapter.in.web.dto.AppointmentResponse;
import personal.clinic.booking.appointment.adapter.in.web.dto.BookAppointmentRequest;
import personal.clinic.booking.appointment.adapter.in.web.dto.BookAppointmentResponse;
import personal.clinic.booking.appointment.adapter.in.web.dto.PatientAppointmentResponse;
import personal.clinic.booking.appointment.application.port.in.BookAppointmentUseCase;
import personal.clinic.booking.appointment.application.port.in.GetAppointmentUseCase;
import personal.clinic.booking.appointment.domain.model.Appointment;

import java.util.List;

/**
 * Appointment API Controller
 * 환자용 예약 생성/조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private final BookAppointmentUseCase bookAppointmentUseCase;
    private final GetAppointmentUseCase getAppointmentUseCase;

    /**
     * 예약 생성
     * POST /api/appointments
     */
    @PostMapping
    public ResponseEntity<BookAppointmentResponse> bookAppointment(
            @Valid @RequestBody BookAppointmentRequest request
    ) {
        log.info("Book appointment: providerId={}, serviceId={}, startTime={}",
                request.providerId(), request.serviceId(), request.startTime());

        Appointment appointment = bookAppointmentUseCase.book(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(BookAppointmentResponse.booked(appointment.id()));
    }

    @GetMapping("/{appointmentId}")
    public ResponseEntity<AppointmentResponse> getAppointment(@PathVariable String appointmentId) {
        return ResponseEntity.ok(AppointmentResponse.from(getAppointmentUseCase.getAppointment(appointmentId)));
    }

    /**
     * 환자 예약 이력
     * GET /api/appointments?email={email}
     */
    @GetMapping
    public ResponseEntity<List<PatientAppointmentResponse>> getPatientHistory(@RequestParam String email) {
        List<PatientAppointmentResponse> response = getAppointmentUseCase.getPatientHistory(email).stream()
                .map(PatientAppointmentResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
