package personal.circle.core.circle.adapter.out.persistence;

import java.util.List;
import java.util.Objects;

/**
 * Circle Row Set
 * 동아리 집합체의 관계형 표현: circles 행 1건 + members 행 N건 (회장 포함)
 * <p>
 * {@link CircleRowMapper#toRows}가 만든 행 집합은 회장 행이 항상 첫 번째에 온다.
 * 저장소에서 읽어 온 행 집합은 순서를 보장하지 않는다.
 *
 * @param circle  circles 행
 * @param members 같은 circle_id로 태깅된 members 행
 */
public record CircleRows(
        CircleEntity circle,
        List<MemberEntity> members
) {
    public CircleRows {
        Objects.requireNonNull(circle, "Circle row cannot be null");
        members = members == null ? List.of() : List.copyOf(members);
    }
}
