package personal.clinic.booking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.ZoneId;

/**
 * Clinic 설정 Properties
 * application.yml의 clinic.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "clinic")
public record ClinicProperties(
        @DefaultValue("America/New_York") String timeZone,
        @DefaultValue Slots slots,
        @DefaultValue Reminder reminder,
        @DefaultValue Notification notification
) {
    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    public record Slots(
            @DefaultValue("8") int maxResults
    ) {}

    public record Reminder(
            @DefaultValue("60000") long sweepIntervalMs,
            @DefaultValue("10000") long sweepInitialDelayMs,
            @DefaultValue("30") int reconciliationWindowDays,
            @DefaultValue("24") int timerLeadHours
    ) {}

    /**
     * 알림 설정 기본값 (DB에 설정 레코드가 없을 때 사용)
     */
    public record Notification(
            @DefaultValue("true") boolean notificationsEnabled,
            @DefaultValue("true") boolean emailNotificationsEnabled,
            @DefaultValue("true") boolean smsNotificationsEnabled,
            @DefaultValue("24") int reminderHoursBefore,
            @DefaultValue("false") boolean bookingApprovalRequired,
            @DefaultValue("50") int outboxBatchSize,
            @DefaultValue("1000") long pollIntervalMs
    ) {}
}
