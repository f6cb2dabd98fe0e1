package personal.circle.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Circle Service Application
 * 동아리(Circle)와 회원 관리를 담당하는 서비스
 */
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.circle.core",
        "personal.circle.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class CircleServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CircleServiceApplication.class, args);
    }
}
