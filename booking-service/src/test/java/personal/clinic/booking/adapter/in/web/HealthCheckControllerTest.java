package personal.clinic.booking.adapter.in.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import personal.clinic.booking.config.ClinicProperties;
import personal.clinic.booking.reminder.application.port.in.GetReminderStatusUseCase;
import personal.clinic.booking.reminder.application.port.in.ReminderSchedulerStatus;
import personal.clinic.common.health.HealthCheckService;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Health Check Controller 단위 테스트
 */
@WebMvcTest(HealthCheckController.class)
@DisplayName("Booking Service Health Check API 단위 테스트")
class HealthCheckControllerTest {

    private static final Instant NOW = Instant.parse("2030-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DataSource dataSource;

    @MockBean
    private HealthCheckService healthCheckService;

    @MockBean
    private GetReminderStatusUseCase getReminderStatusUseCase;

    @MockBean
    private ClinicProperties clinicProperties;

    @MockBean
    private Clock clock;

    @BeforeEach
    void setUp() {
        given(clock.millis()).willReturn(NOW.toEpochMilli());
        given(clinicProperties.reminder()).willReturn(new ClinicProperties.Reminder(60_000, 10_000, 30, 24));
        given(getReminderStatusUseCase.getStatus()).willReturn(new ReminderSchedulerStatus(3, NOW));
    }

    @Test
    @DisplayName("DB와 스케줄러가 정상이면 success를 반환한다")
    void healthCheckReturnsSuccess() throws Exception {
        // Given
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("UP");
        given(healthCheckService.checkScheduler(anyLong(), anyLong(), anyLong())).willReturn("UP");

        // When & Then
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.message").isString())
                .andExpect(jsonPath("$.data.database").value("UP"))
                .andExpect(jsonPath("$.data.scheduler").value("UP"));
    }

    @Test
    @DisplayName("기동 직후 스케줄러가 STARTING이어도 정상으로 본다")
    void startingSchedulerIsHealthy() throws Exception {
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("UP");
        given(healthCheckService.checkScheduler(anyLong(), anyLong(), anyLong())).willReturn("STARTING");

        mockMvc.perform(get("/api/health"))
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.scheduler").value("STARTING"));
    }

    @Test
    @DisplayName("DB 연결 실패 시 error 결과와 컴포넌트 상태를 반환한다")
    void databaseDownReturnsError() throws Exception {
        // Given
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("DOWN");
        given(healthCheckService.checkScheduler(anyLong(), anyLong(), anyLong())).willReturn("UP");

        // When & Then
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.data.database").value("DOWN"));
    }
}
