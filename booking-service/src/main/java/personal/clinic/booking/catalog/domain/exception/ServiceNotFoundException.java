package personal.clinic.booking.catalog.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * 진료 서비스를 찾을 수 없는 경우
 */
public class ServiceNotFoundException extends BusinessException {
    public ServiceNotFoundException(String serviceId) {
        super(ErrorCode.SERVICE_NOT_FOUND,
                String.format("Service not found: serviceId=%s", serviceId));
    }
}
