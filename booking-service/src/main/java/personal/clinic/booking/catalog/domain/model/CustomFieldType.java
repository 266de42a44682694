package personal.clinic.booking.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CustomFieldType {
    TEXT,
    EMAIL,
    PHONE,
    TEXTAREA,
    CHECKBOX,
    SELECT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CustomFieldType from(String value) {
        return CustomFieldType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
