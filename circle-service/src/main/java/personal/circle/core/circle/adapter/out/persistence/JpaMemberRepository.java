package personal.circle.core.circle.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Spring Data JPA Repository for Member rows
 */
public interface JpaMemberRepository extends JpaRepository<MemberEntity, Long> {

    /**
     * 동아리의 모든 회원 행 조회 (회장 포함)
     */
    List<MemberEntity> findByCircleIdOrderByIdAsc(Long circleId);

    /**
     * 동아리의 모든 회원 행 삭제
     * 대량 삭제 전 변경 내용을 flush하고, 이후 영속성 컨텍스트를 비운다
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM MemberEntity m WHERE m.circleId = :circleId")
    int deleteByCircleId(@Param("circleId") Long circleId);

    /**
     * 기존 ID를 유지한 채 회원 행 삽입
     * 수정 시 삭제 후 재삽입되는 회원이 같은 ID를 갖도록 한다
     */
    @Modifying
    @Query(value = "INSERT INTO members (id, name, age, grade, major, circle_id) "
            + "VALUES (:id, :name, :age, :grade, :major, :circleId)", nativeQuery = true)
    int insertWithId(@Param("id") Long id,
                     @Param("name") String name,
                     @Param("age") int age,
                     @Param("grade") int grade,
                     @Param("major") String major,
                     @Param("circleId") Long circleId);
}
