package personal.clinic.booking.appointment.adapter.in.web;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.booking.appointment.adapter.in.web.dto.TimeSlotResponse;
import personal.clinic.booking.appointment.application.port.in.GetAvailableSlotsUseCase;

import java.time.LocalDate;
import java.util.List;

/**
 * Slot API Controller
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/slots")
@RequiredArgsConstructor
public class SlotController {

    private final GetAvailableSlotsUseCase getAvailableSlotsUseCase;

    /**
     * 예약 가능 시간대 조회
     * GET /api/slots?providerId={providerId}&date={YYYY-MM-DD}&duration={minutes}
     */
    @GetMapping
    public ResponseEntity<List<TimeSlotResponse>> getAvailableSlots(
            @RequestParam @NotBlank String providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @Min(1) int duration
    ) {
        log.debug("Get available slots: providerId={}, date={}, duration={}", providerId, date, duration);

        List<TimeSlotResponse> response = getAvailableSlotsUseCase.getAvailableSlots(providerId, date, duration)
                .stream()
                .map(TimeSlotResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }
}
