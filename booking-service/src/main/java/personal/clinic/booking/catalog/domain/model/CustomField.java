package personal.clinic.booking.catalog.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.util.List;

/**
 * 예약 폼의 서비스별 추가 입력 항목
 */
public record CustomField(
        String name,
        CustomFieldType type,
        boolean required,
        int order,
        List<String> options) {

    public CustomField {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Custom field name is required");
        }
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Custom field type is required: " + name);
        }
        options = options == null ? List.of() : List.copyOf(options);
        if (type == CustomFieldType.SELECT && options.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Select field requires options: " + name);
        }
    }
}
