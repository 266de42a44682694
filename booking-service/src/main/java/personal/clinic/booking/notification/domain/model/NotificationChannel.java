package personal.clinic.booking.notification.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationChannel {
    EMAIL,
    SMS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
