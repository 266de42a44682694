package personal.clinic.booking.catalog.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Provider Availability Not Found Exception
 * 의료진의 근무 시간 레코드가 없는 경우 (슬롯 조회 시 404)
 */
public class ProviderAvailabilityNotFoundException extends BusinessException {
    public ProviderAvailabilityNotFoundException(String providerId) {
        super(ErrorCode.AVAILABILITY_NOT_FOUND,
                String.format("Provider availability not found: providerId=%s", providerId));
    }
}
