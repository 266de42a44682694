package personal.clinic.booking.notification.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.clinic.booking.audit.adapter.in.web.StaffActors;
import personal.clinic.booking.notification.adapter.in.web.dto.NotificationSettingsRequest;
import personal.clinic.booking.notification.application.port.in.ManageNotificationSettingsUseCase;
import personal.clinic.booking.notification.domain.model.NotificationSettings;

/**
 * Notification Settings Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/settings/notifications")
@RequiredArgsConstructor
public class NotificationSettingsController {

    private final ManageNotificationSettingsUseCase manageNotificationSettingsUseCase;

    @GetMapping
    public ResponseEntity<NotificationSettings> getSettings() {
        return ResponseEntity.ok(manageNotificationSettingsUseCase.getSettings());
    }

    @PutMapping
    public ResponseEntity<NotificationSettings> updateSettings(
            @Valid @RequestBody NotificationSettingsRequest request,
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Update notification settings: {}", request);
        return ResponseEntity.ok(manageNotificationSettingsUseCase.updateSettings(
                request.toCommand(), StaffActors.from(staffEmail, httpRequest)));
    }

    /**
     * 기본값으로 초기화
     * POST /api/admin/settings/notifications/reset
     */
    @PostMapping("/reset")
    public ResponseEntity<NotificationSettings> resetSettings(
            @RequestHeader(value = StaffActors.STAFF_EMAIL_HEADER, required = false) String staffEmail,
            HttpServletRequest httpRequest
    ) {
        log.info("Reset notification settings");
        return ResponseEntity.ok(manageNotificationSettingsUseCase.resetSettings(
                StaffActors.from(staffEmail, httpRequest)));
    }
}
