package personal.clinic.booking.catalog.application.port.in;

import java.util.Set;

/**
 * 의료진 생성/수정 커맨드
 */
public record SaveProviderCommand(
        String name,
        String email,
        String phone,
        String speciality,
        Set<String> serviceIds
) {
}
