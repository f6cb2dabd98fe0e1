package personal.circle.core.circle.application.port.in;

import personal.circle.core.circle.domain.model.CircleId;
import personal.circle.core.circle.domain.model.MemberId;

/**
 * Create Circle Result
 * 생성된 동아리 ID와 회장 ID
 */
public record CreateCircleResult(
        CircleId circleId,
        MemberId ownerId
) {
}
