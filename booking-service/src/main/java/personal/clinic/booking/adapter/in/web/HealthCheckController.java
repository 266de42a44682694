package personal.clinic.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.booking.config.ClinicProperties;
import personal.clinic.booking.reminder.application.port.in.GetReminderStatusUseCase;
import personal.clinic.booking.reminder.application.port.in.ReminderSchedulerStatus;
import personal.clinic.common.dto.ApiResponse;
import personal.clinic.common.dto.HealthCheckResponse;
import personal.clinic.common.health.HealthCheckService;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Health Check API Controller
 * 데이터베이스 연결과 리마인더 스케줄러 상태를 확인
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthCheckController {

    private static final int ALLOWED_MISSED_SWEEPS = 3;

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;
    private final GetReminderStatusUseCase getReminderStatusUseCase;
    private final ClinicProperties clinicProperties;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        ReminderSchedulerStatus reminderStatus = getReminderStatusUseCase.getStatus();
        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        String schedulerStatus = healthCheckService.checkScheduler(
                reminderStatus.lastSweepAt() == null ? 0 : reminderStatus.lastSweepAt().toEpochMilli(),
                clock.millis(),
                clinicProperties.reminder().sweepIntervalMs() * ALLOWED_MISSED_SWEEPS);

        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, schedulerStatus);

        if ("UP".equals(databaseStatus) && !"DOWN".equals(schedulerStatus)) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
