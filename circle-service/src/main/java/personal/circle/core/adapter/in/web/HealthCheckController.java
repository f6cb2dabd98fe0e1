package personal.circle.core.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.circle.common.dto.ApiResponse;
import personal.circle.common.dto.HealthCheckResponse;
import personal.circle.common.health.HealthCheckService;
import personal.circle.core.config.ServiceInfoProperties;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 애플리케이션 및 데이터베이스 상태와 서비스 버전을 확인하는 엔드포인트를 제공합니다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;
    private final ServiceInfoProperties serviceInfoProperties;

    /**
     * Health Check 엔드포인트
     *
     * @return ApiResponse with health check data
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);

        HealthCheckResponse data = new HealthCheckResponse(
                databaseStatus,
                serviceInfoProperties.version()
        );

        if ("UP".equals(databaseStatus)) {
            return ResponseEntity.ok(
                    ApiResponse.success(serviceInfoProperties.name() + " is healthy", data)
            );
        } else {
            return ResponseEntity.ok(
                    ApiResponse.error("Database is unavailable", data)
            );
        }
    }
}
