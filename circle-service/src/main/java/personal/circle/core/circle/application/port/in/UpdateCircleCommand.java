package personal.circle.core.circle.application.port.in;

import personal.circle.core.circle.domain.model.CircleId;

import java.util.Objects;

/**
 * Update Circle Command
 * 동아리 수정 커맨드. circleName/capacity가 null이면 기존 값을 유지한다
 */
public record UpdateCircleCommand(
        CircleId circleId,
        String circleName,
        Integer capacity
) {
    public UpdateCircleCommand {
        Objects.requireNonNull(circleId, "Circle ID cannot be null");
    }
}
