package personal.circle.core.circle.application.port.in;

import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;

/**
 * Get Circle UseCase (Input Port)
 * 동아리 조회 유스케이스
 */
public interface GetCircleUseCase {

    /**
     * 동아리 ID로 조회
     *
     * @param circleId 동아리 ID
     * @return 동아리 집합체
     * @throws personal.circle.core.circle.domain.exception.CircleNotFoundException 동아리가 존재하지 않을 때
     */
    Circle getCircle(CircleId circleId);
}
