package personal.circle.core.circle.adapter.out.persistence;

import org.springframework.stereotype.Component;
import personal.circle.common.validation.Validated;
import personal.circle.core.circle.domain.exception.CircleDataIntegrityException;
import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;
import personal.circle.core.circle.domain.model.Grade;
import personal.circle.core.circle.domain.model.Major;
import personal.circle.core.circle.domain.model.Member;
import personal.circle.core.circle.domain.model.MemberId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Circle Row Mapper
 * 동아리 집합체 ↔ 관계형 행 집합 변환
 * <p>
 * 회장은 저장소에서 members 행 중 하나로 중복 저장되지만, 집합체의 members 목록에는
 * 절대 포함되지 않는다. 회장/회원 분리와 병합은 이 클래스에서만 일어난다.
 */
@Component
public class CircleRowMapper {

    /**
     * 집합체 → 행 집합
     * 회장 행이 첫 번째, 이후 나머지 회원 행. 미부여 ID는 null(삽입 시 생성)로 변환한다.
     */
    public CircleRows toRows(Circle circle) {
        Long circleId = circle.id().isAssigned() ? circle.id().value() : null;
        Member owner = circle.owner();
        Long ownerId = owner.id().isAssigned() ? owner.id().value() : CircleEntity.PENDING_OWNER_ID;

        CircleEntity circleRow = CircleEntity.of(circleId, circle.name(), ownerId, circle.capacity());

        List<MemberEntity> memberRows = new ArrayList<>(circle.members().size() + 1);
        memberRows.add(toRow(owner, circleId));
        circle.members().forEach(member -> memberRows.add(toRow(member, circleId)));

        return new CircleRows(circleRow, memberRows);
    }

    /**
     * 행 집합 → 집합체
     *
     * @throws CircleDataIntegrityException owner_id와 일치하는 회원 행이 없거나, 다른 동아리의 행이 섞여 있거나,
     *                                      저장된 학년/전공 값이 올바르지 않은 경우
     */
    public Circle toDomain(CircleRows rows) {
        CircleEntity circleRow = rows.circle();
        CircleId circleId = CircleId.of(circleRow.getId() == null ? 0L : circleRow.getId());
        Long ownerId = circleRow.getOwnerId();

        for (MemberEntity row : rows.members()) {
            if (!Objects.equals(row.getCircleId(), circleRow.getId())) {
                throw new CircleDataIntegrityException(circleId,
                        String.format("Member row %s belongs to circle %s", row.getId(), row.getCircleId()));
            }
        }

        MemberEntity ownerRow = rows.members().stream()
                .filter(row -> row.getId() != null && row.getId().equals(ownerId))
                .findFirst()
                .orElseThrow(() -> CircleDataIntegrityException.ownerNotFound(
                        circleId, ownerId == null ? 0L : ownerId));

        List<Member> others = rows.members().stream()
                .filter(row -> row != ownerRow)
                .sorted(Comparator.comparing(MemberEntity::getId,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(row -> toMember(circleId, row))
                .toList();

        return Circle.reconstruct(
                circleId,
                circleRow.getName(),
                toMember(circleId, ownerRow),
                circleRow.getCapacity(),
                others);
    }

    private MemberEntity toRow(Member member, Long circleId) {
        Long memberId = member.id().isAssigned() ? member.id().value() : null;
        return MemberEntity.of(
                memberId,
                member.name(),
                member.age(),
                member.grade().value(),
                member.major().label(),
                circleId);
    }

    private Member toMember(CircleId circleId, MemberEntity row) {
        Grade grade = requireStored(circleId, row, Grade.of(row.getGrade()));
        Major major = requireStored(circleId, row, Major.parse(row.getMajor()));
        return Member.reconstruct(
                MemberId.of(row.getId() == null ? 0L : row.getId()),
                row.getName(),
                row.getAge(),
                grade,
                major);
    }

    private <T> T requireStored(CircleId circleId, MemberEntity row, Validated<T> value) {
        if (!value.isValid()) {
            String detail = value.error()
                    .map(error -> String.format("Malformed member row %s (%s)", row.getId(), error))
                    .orElse("Malformed member row " + row.getId());
            throw new CircleDataIntegrityException(circleId, detail);
        }
        return value.orElseThrow();
    }
}
