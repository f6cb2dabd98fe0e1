package personal.circle.common.dto;

/**
 * Health Check 응답 데이터
 *
 * @param database 데이터베이스 상태 ("UP" 또는 "DOWN")
 * @param version  서비스 버전
 */
public record HealthCheckResponse(
        String database,
        String version
) {
}
