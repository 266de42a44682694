package personal.clinic.booking.catalog.application.port.in;

import personal.clinic.booking.catalog.domain.model.CustomField;

import java.util.List;
import java.util.Set;

/**
 * 진료 서비스 생성/수정 커맨드
 */
public record SaveServiceCommand(
        String name,
        String description,
        int duration,
        Set<String> providerIds,
        List<CustomField> customFields
) {
}
