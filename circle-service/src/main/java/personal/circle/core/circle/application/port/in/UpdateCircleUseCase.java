package personal.circle.core.circle.application.port.in;

import personal.circle.core.circle.domain.model.CircleId;

/**
 * Update Circle UseCase (Input Port)
 * 동아리 수정 유스케이스
 */
public interface UpdateCircleUseCase {

    /**
     * 동아리 이름/정원 수정
     *
     * @param command 수정 커맨드
     * @return 수정된 동아리 ID
     * @throws personal.circle.core.circle.domain.exception.CircleNotFoundException 동아리가 존재하지 않을 때
     * @throws personal.circle.common.validation.ValidationException 정원이 현재 인원보다 작을 때
     */
    CircleId updateCircle(UpdateCircleCommand command);
}
