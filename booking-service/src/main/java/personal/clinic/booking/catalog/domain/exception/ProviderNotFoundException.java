package personal.clinic.booking.catalog.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * 의료진을 찾을 수 없는 경우
 */
public class ProviderNotFoundException extends BusinessException {
    public ProviderNotFoundException(String providerId) {
        super(ErrorCode.PROVIDER_NOT_FOUND,
                String.format("Provider not found: providerId=%s", providerId));
    }
}
