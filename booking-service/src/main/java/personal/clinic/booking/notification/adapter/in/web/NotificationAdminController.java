package personal.clinic.booking.notification.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.booking.notification.adapter.in.web.dto.NotificationLogResponse;
import personal.clinic.booking.notification.application.port.in.QueryNotificationLogsUseCase;
import personal.clinic.booking.notification.application.port.in.ReminderStats;

import java.util.List;

/**
 * Notification Admin Controller
 * 발송 로그, 리마인더 통계 조회
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/notifications")
@RequiredArgsConstructor
public class NotificationAdminController {

    private final QueryNotificationLogsUseCase queryNotificationLogsUseCase;

    @GetMapping("/logs")
    public ResponseEntity<List<NotificationLogResponse>> getLogs(
            @RequestParam(required = false) String appointmentId) {
        log.debug("Notification logs requested: appointmentId={}", appointmentId);
        return ResponseEntity.ok(queryNotificationLogsUseCase.getRecentLogs(appointmentId).stream()
                .map(NotificationLogResponse::from)
                .toList());
    }

    @GetMapping("/reminders/stats")
    public ResponseEntity<ReminderStats> getReminderStats() {
        return ResponseEntity.ok(queryNotificationLogsUseCase.getReminderStats());
    }
}
