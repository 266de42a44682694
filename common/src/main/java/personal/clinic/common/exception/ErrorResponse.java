package personal.clinic.common.exception;

/**
 * 에러 응답 포맷
 * { "success": false, "error": { "code": "...", "message": "..." } }
 */
public record ErrorResponse(
        boolean success,
        ErrorDetail error
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(false, new ErrorDetail(errorCode.getCode(), message));
    }

    public record ErrorDetail(
            String code,
            String message
    ) {
    }
}
