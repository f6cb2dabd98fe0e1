package personal.circle.core.circle.application.port.in;

/**
 * Create Circle UseCase (Input Port)
 * 동아리 생성 유스케이스
 */
public interface CreateCircleUseCase {

    /**
     * 동아리 생성
     * 입력값 검증은 저장소 접근 전에 끝난다
     *
     * @param command 생성 커맨드
     * @return 부여된 동아리 ID와 회장 ID
     * @throws personal.circle.common.validation.ValidationException 학년/전공/정원/이름 검증 실패 시
     */
    CreateCircleResult createCircle(CreateCircleCommand command);
}
