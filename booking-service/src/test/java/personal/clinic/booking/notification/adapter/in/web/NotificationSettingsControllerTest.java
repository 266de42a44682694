package personal.clinic.booking.notification.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.clinic.booking.audit.domain.model.StaffActor;
import personal.clinic.booking.notification.application.port.in.ManageNotificationSettingsUseCase;
import personal.clinic.booking.notification.application.port.in.UpdateNotificationSettingsCommand;
import personal.clinic.booking.notification.domain.model.NotificationSettings;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NotificationSettingsController.class)
@DisplayName("Notification Settings API 단위 테스트")
class NotificationSettingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ManageNotificationSettingsUseCase manageNotificationSettingsUseCase;

    @Test
    @DisplayName("현재 설정을 조회한다")
    void getSettings() throws Exception {
        given(manageNotificationSettingsUseCase.getSettings())
                .willReturn(new NotificationSettings(true, true, false, 24, false, null));

        mockMvc.perform(get("/api/admin/settings/notifications"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notificationsEnabled").value(true))
                .andExpect(jsonPath("$.smsNotificationsEnabled").value(false))
                .andExpect(jsonPath("$.reminderHoursBefore").value(24));
    }

    @Test
    @DisplayName("일부 필드만 보내면 나머지는 null로 전달된다")
    void partialUpdate() throws Exception {
        given(manageNotificationSettingsUseCase.updateSettings(any(), any()))
                .willReturn(new NotificationSettings(true, true, true, 12, false,
                        Instant.parse("2030-03-01T12:00:00Z")));

        mockMvc.perform(put("/api/admin/settings/notifications")
                        .header("X-Staff-Email", "staff@clinic.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reminderHoursBefore\":12}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reminderHoursBefore").value(12));

        then(manageNotificationSettingsUseCase).should().updateSettings(
                argThat((UpdateNotificationSettingsCommand command) -> command.reminderHoursBefore() == 12
                        && command.notificationsEnabled() == null),
                argThat((StaffActor actor) -> actor.email().equals("staff@clinic.com")));
    }

    @Test
    @DisplayName("reminderHoursBefore가 1~168 범위를 벗어나면 400")
    void outOfRangeHoursReturns400() throws Exception {
        mockMvc.perform(put("/api/admin/settings/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reminderHoursBefore\":169}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_INPUT"));

        then(manageNotificationSettingsUseCase).should(never()).updateSettings(any(), any());
    }
}
