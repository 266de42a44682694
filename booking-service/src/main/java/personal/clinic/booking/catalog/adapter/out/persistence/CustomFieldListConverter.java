package personal.clinic.booking.catalog.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import personal.clinic.booking.catalog.domain.model.CustomField;

import java.util.List;

/**
 * 커스텀 필드 목록 <-> JSON 문자열 변환
 */
@Converter
public class CustomFieldListConverter implements AttributeConverter<List<CustomField>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<CustomField>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<CustomField> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "[]";
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize custom fields", e);
        }
    }

    @Override
    public List<CustomField> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return List.of();
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize custom fields", e);
        }
    }
}
