package personal.circle.core.circle.application.port.in;

import personal.circle.core.circle.domain.model.CircleId;

/**
 * Delete Circle UseCase (Input Port)
 * 동아리 삭제 유스케이스
 */
public interface DeleteCircleUseCase {

    /**
     * @throws personal.circle.core.circle.domain.exception.CircleNotFoundException 동아리가 존재하지 않을 때
     */
    void deleteCircle(CircleId circleId);
}
