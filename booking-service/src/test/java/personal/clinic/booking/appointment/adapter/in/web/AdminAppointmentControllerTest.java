package personal.clinic.booking.appointment.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.clinic.booking.appointment.application.port.in.ManageAppointmentUseCase;
import personal.clinic.booking.appointment.application.port.in.RescheduleCommand;
import personal.clinic.booking.appointment.application.port.in.SearchAppointmentsUseCase;
import personal.clinic.booking.appointment.domain.exception.InvalidStatusTransitionException;
import personal.clinic.booking.appointment.domain.model.AppointmentStatus;
import personal.clinic.booking.audit.domain.model.StaffActor;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminAppointmentController.class)
@DisplayName("Admin Appointment API 단위 테스트")
class AdminAppointmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SearchAppointmentsUseCase searchAppointmentsUseCase;

    @MockBean
    private ManageAppointmentUseCase manageAppointmentUseCase;

    @Test
    @DisplayName("소문자 상태 값으로 상태를 변경하고 직원 정보를 전달한다")
    void updateStatusPassesStaffActor() throws Exception {
        mockMvc.perform(patch("/api/admin/appointments/a1/status")
                        .header("X-Staff-Email", "staff@clinic.com")
                        .header("X-Forwarded-For", "10.0.0.1, 10.0.0.2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"confirmed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        then(manageAppointmentUseCase).should().updateStatus(eq("a1"), eq(AppointmentStatus.CONFIRMED),
                argThat((StaffActor actor) -> actor.email().equals("staff@clinic.com")
                        && actor.ipAddress().equals("10.0.0.1")));
    }

    @Test
    @DisplayName("허용되지 않는 전환은 400 INVALID_STATUS_TRANSITION")
    void invalidTransitionReturns400() throws Exception {
        given(manageAppointmentUseCase.updateStatus(eq("a1"), eq(AppointmentStatus.CONFIRMED), any()))
                .willThrow(new InvalidStatusTransitionException(AppointmentStatus.CANCELLED,
                        AppointmentStatus.CONFIRMED));

        mockMvc.perform(patch("/api/admin/appointments/a1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"confirmed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_STATUS_TRANSITION"))
                .andExpect(jsonPath("$.error.message")
                        .value("Cannot change appointment status from cancelled to confirmed"));
    }

    @Test
    @DisplayName("일정 변경 요청을 커맨드로 변환한다")
    void rescheduleBuildsCommand() throws Exception {
        mockMvc.perform(patch("/api/admin/appointments/a1/reschedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"newStartTime":"2030-03-05T14:00:00Z",
                                 "newEndTime":"2030-03-05T14:30:00Z",
                                 "reason":"Provider unavailable"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Appointment rescheduled successfully"));

        then(manageAppointmentUseCase).should().reschedule(
                argThat((RescheduleCommand command) -> command.appointmentId().equals("a1")
                        && "Provider unavailable".equals(command.reason())),
                argThat((StaffActor actor) -> actor.email().equals("unknown")));
    }

    @Test
    @DisplayName("예약 취소")
    void cancel() throws Exception {
        mockMvc.perform(post("/api/admin/appointments/a1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Appointment cancelled"));

        then(manageAppointmentUseCase).should().cancel(eq("a1"), any(StaffActor.class));
    }

    @Test
    @DisplayName("limit 범위를 벗어나면 400")
    void limitOutOfRangeReturns400() throws Exception {
        mockMvc.perform(get("/api/admin/appointments").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_INPUT"));
    }
}
