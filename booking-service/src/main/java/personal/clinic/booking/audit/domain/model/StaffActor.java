package personal.clinic.booking.audit.domain.model;

/**
 * 변경을 수행한 직원 정보
 * 인증 계층이 없으므로 요청 헤더에서 전달된 값을 그대로 기록한다.
 */
public record StaffActor(
        String email,
        String ipAddress,
        String userAgent) {
}
