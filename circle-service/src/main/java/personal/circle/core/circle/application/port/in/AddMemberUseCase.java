package personal.circle.core.circle.application.port.in;

import personal.circle.core.circle.domain.model.Circle;

/**
 * Add Member UseCase (Input Port)
 * 동아리 회원 추가 유스케이스
 */
public interface AddMemberUseCase {

    /**
     * 회원 추가
     *
     * @param command 추가 커맨드
     * @return 회원이 추가된 동아리 (새 회원 ID 부여됨)
     * @throws personal.circle.core.circle.domain.exception.CircleNotFoundException 동아리가 존재하지 않을 때
     * @throws personal.circle.common.validation.ValidationException 회원 정보가 잘못되었거나 정원이 가득 찼을 때
     */
    Circle addMember(AddMemberCommand command);
}
