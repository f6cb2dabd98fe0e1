package personal.circle.core.circle.adapter.in.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import personal.circle.core.circle.application.port.in.UpdateCircleCommand;
import personal.circle.core.circle.domain.model.CircleId;

/**
 * 동아리 수정 요청 DTO
 * 생략된 항목은 기존 값을 유지한다
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateCircleRequest(
        String circleName,
        Integer capacity
) {
    public UpdateCircleCommand toCommand(long circleId) {
        return new UpdateCircleCommand(CircleId.of(circleId), circleName, capacity);
    }
}
