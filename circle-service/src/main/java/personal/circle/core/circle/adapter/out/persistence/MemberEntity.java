package personal.circle.core.circle.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Member JPA Entity
 * members 테이블 행 매핑. 회장도 같은 테이블에 한 행으로 저장된다
 */
@Entity
@Table(name = "members")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MemberEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int age;

    @Column(nullable = false)
    private int grade;

    @Column(nullable = false)
    private String major;

    @Column(name = "circle_id")
    private Long circleId;

    public static MemberEntity of(Long id, String name, int age, int grade, String major, Long circleId) {
        MemberEntity entity = new MemberEntity();
        entity.id = id;
        entity.name = name;
        entity.age = age;
        entity.grade = grade;
        entity.major = major;
        entity.circleId = circleId;
        return entity;
    }

    /**
     * 같은 회원 정보를 다른 동아리 ID로 태깅한 새 행
     */
    public MemberEntity forCircle(Long targetCircleId) {
        return of(id, name, age, grade, major, targetCircleId);
    }
}
