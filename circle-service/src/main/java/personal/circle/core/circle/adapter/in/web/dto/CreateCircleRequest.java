package personal.circle.core.circle.adapter.in.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import personal.circle.core.circle.application.port.in.CreateCircleCommand;

/**
 * 동아리 생성 요청 DTO
 * 값의 범위 검증은 도메인에서 수행하고, 여기서는 필수 여부만 확인한다
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateCircleRequest(
        @NotNull(message = "circle_name은 필수입니다.")
        String circleName,

        @NotNull(message = "capacity는 필수입니다.")
        Integer capacity,

        @NotNull(message = "owner_name은 필수입니다.")
        String ownerName,

        @NotNull(message = "owner_age는 필수입니다.")
        Integer ownerAge,

        @NotNull(message = "owner_grade는 필수입니다.")
        Integer ownerGrade,

        @NotNull(message = "owner_major는 필수입니다.")
        String ownerMajor
) {
    public CreateCircleCommand toCommand() {
        return new CreateCircleCommand(circleName, capacity, ownerName, ownerAge, ownerGrade, ownerMajor);
    }
}
