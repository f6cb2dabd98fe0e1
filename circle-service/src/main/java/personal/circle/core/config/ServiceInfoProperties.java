package personal.circle.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Service 정보 Properties
 * application.yml의 service.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "service")
public record ServiceInfoProperties(
        String name,
        String version
) {
    public ServiceInfoProperties {
        if (name == null || name.isBlank()) {
            name = "circle-service";
        }
        if (version == null || version.isBlank()) {
            version = "unknown";
        }
    }
}
