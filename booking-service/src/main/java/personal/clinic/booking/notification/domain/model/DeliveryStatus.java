package personal.clinic.booking.notification.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 알림 발송 결과
 */
public enum DeliveryStatus {
    SENT,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
