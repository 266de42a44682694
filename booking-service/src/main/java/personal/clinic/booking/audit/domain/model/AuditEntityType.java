package personal.clinic.booking.audit.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditEntityType {
    APPOINTMENT,
    SERVICE,
    PROVIDER,
    AVAILABILITY,
    SETTINGS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditEntityType from(String value) {
        return AuditEntityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
