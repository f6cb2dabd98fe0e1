package personal.circle.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * CORS 설정 Properties
 * application.yml의 cors.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "cors")
public record CorsProperties(
        List<String> allowedOrigins,
        long maxAgeSeconds
) {
    public CorsProperties {
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        if (maxAgeSeconds <= 0) {
            maxAgeSeconds = 3600;
        }
    }
}
