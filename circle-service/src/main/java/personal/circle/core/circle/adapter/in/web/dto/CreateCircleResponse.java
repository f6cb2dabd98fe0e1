package personal.circle.core.circle.adapter.in.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import personal.circle.core.circle.application.port.in.CreateCircleResult;

/**
 * 동아리 생성 응답 DTO
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateCircleResponse(
        long circleId,
        long ownerId
) {
    public static CreateCircleResponse from(CreateCircleResult result) {
        return new CreateCircleResponse(result.circleId().value(), result.ownerId().value());
    }
}
