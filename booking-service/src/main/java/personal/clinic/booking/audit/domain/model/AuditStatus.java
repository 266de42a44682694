package personal.clinic.booking.audit.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditStatus {
    SUCCESS,
    FAILURE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
