package personal.clinic.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code, 클라이언트용 코드 문자열, 기본 메시지를 함께 관리
 * 같은 종류의 오류는 같은 코드 문자열을 공유한다 (예: *_NOT_FOUND -> "NOT_FOUND")
 */
public enum ErrorCode {
    // Validation
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "잘못된 입력값입니다."),
    MISSING_REQUIRED_FIELD(HttpStatus.BAD_REQUEST, "MISSING_REQUIRED_FIELD", "필수 입력값이 누락되었습니다."),
    INVALID_EMAIL(HttpStatus.BAD_REQUEST, "INVALID_EMAIL", "이메일 형식이 올바르지 않습니다."),
    INVALID_PHONE(HttpStatus.BAD_REQUEST, "INVALID_PHONE", "전화번호 형식이 올바르지 않습니다."),

    // Resource
    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "요청한 리소스를 찾을 수 없습니다."),
    APPOINTMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "Appointment not found"),
    SERVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "Service not found"),
    PROVIDER_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "Provider not found"),
    AVAILABILITY_NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND", "Provider availability not found"),

    // Booking
    DOUBLE_BOOKING(HttpStatus.CONFLICT, "DOUBLE_BOOKING",
            "This time slot is no longer available. Please select another slot."),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, "INVALID_STATUS_TRANSITION", "허용되지 않는 상태 전환입니다."),

    // Server
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다."),
    DATABASE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR", "데이터베이스 오류가 발생했습니다."),

    // External Service
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "EXTERNAL_SERVICE_ERROR", "외부 서비스 오류가 발생했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
