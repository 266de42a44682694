package personal.clinic.common.dto;

/**
 * Health Check 응답 데이터
 */
public record HealthCheckResponse(
        String database,
        String scheduler
) {
}
