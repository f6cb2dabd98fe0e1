package personal.circle.core.circle.application.port.out;

import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;

import java.util.Optional;

/**
 * Circle Repository (Output Port)
 * 동아리 집합체 저장소 인터페이스
 * <p>
 * 동아리 행과 회원 행 여러 건으로 저장되지만, 각 쓰기 연산은 하나의 원자적 단위로 동작한다.
 */
public interface CircleRepository {

    /**
     * 동아리 ID로 조회
     *
     * @param circleId 동아리 ID
     * @return 동아리 집합체 (없으면 Optional.empty())
     * @throws personal.circle.core.circle.domain.exception.CircleDataIntegrityException 회장 행이 없는 등 저장 데이터가 손상된 경우
     */
    Optional<Circle> findById(CircleId circleId);

    /**
     * 동아리 생성
     *
     * @param circle 저장되지 않은 동아리
     * @return 동아리/회장/회원 ID가 모두 부여된 동아리
     */
    Circle create(Circle circle);

    /**
     * 동아리 수정 (회원 행 전체 삭제 후 재저장)
     *
     * @param circle 수정할 동아리
     * @return 저장된 동아리
     * @throws personal.circle.core.circle.domain.exception.CircleNotFoundException 동아리 행이 없을 때
     */
    Circle update(Circle circle);

    /**
     * 동아리 삭제 (회원 행 먼저, 동아리 행 나중)
     *
     * @param circle 삭제할 동아리
     */
    void delete(Circle circle);

    /**
     * 동아리 ID로 모든 행 삭제
     * 집합체로 복원하지 않으므로 회장 행이 손상된 동아리도 지울 수 있다
     *
     * @return 동아리 행이 있어 삭제했으면 true
     */
    boolean deleteById(CircleId circleId);
}
