package personal.circle.core.circle.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Circle JPA Entity
 * circles 테이블 행 매핑 (회원 목록은 members 테이블에 별도 저장)
 */
@Entity
@Table(name = "circles")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CircleEntity {

    /**
     * 회장 행이 아직 저장되지 않았을 때 사용하는 임시 owner_id
     */
    public static final long PENDING_OWNER_ID = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private int capacity;

    public static CircleEntity of(Long id, String name, Long ownerId, int capacity) {
        CircleEntity entity = new CircleEntity();
        entity.id = id;
        entity.name = name;
        entity.ownerId = ownerId;
        entity.capacity = capacity;
        return entity;
    }

    /**
     * 변경 가능한 컬럼 반영 (영속성 컨텍스트 내에서 사용)
     */
    public void updateDetails(String name, int capacity) {
        this.name = name;
        this.capacity = capacity;
    }

    public void assignOwner(Long ownerId) {
        this.ownerId = ownerId;
    }
}
