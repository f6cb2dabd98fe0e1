package personal.circle.core.circle.domain.model;

import personal.circle.common.validation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Circle Aggregate
 * 동아리 도메인 모델 (불변)
 * <p>
 * members에는 회장(owner)을 제외한 회원만 담긴다. 정원은 항상 회장 포함 인원 이상이어야 한다.
 */
public record Circle(
        CircleId id,
        String name,
        int capacity,
        Member owner,
        List<Member> members
) {
    public Circle {
        Objects.requireNonNull(id, "Circle ID cannot be null");
        Objects.requireNonNull(owner, "Circle owner cannot be null");
        members = members == null ? List.of() : List.copyOf(members);
    }

    /**
     * 동아리 생성 (정적 팩토리 메서드)
     * 회장이 유일한 구성원인 상태로 시작한다
     *
     * @return 이름이 비었거나 정원이 1 미만이면 검증 실패
     */
    public static Validated<Circle> create(String name, int capacity, Member owner) {
        if (owner == null) {
            return Validated.invalid("owner", "Circle owner cannot be null");
        }
        return validateName(name)
                .<Circle>flatMap(validName -> validateCapacity(capacity)
                        .map(validCapacity -> new Circle(
                                CircleId.unassigned(), validName, validCapacity, owner, List.of())));
    }

    /**
     * 동아리 이름 검증 (현재 구성원과 무관한 규칙)
     */
    public static Validated<String> validateName(String name) {
        if (name == null || name.isBlank()) {
            return Validated.invalid("circle_name", "Circle name cannot be null or blank");
        }
        return Validated.valid(name);
    }

    /**
     * 정원 하한 검증 (현재 구성원과 무관한 규칙)
     */
    public static Validated<Integer> validateCapacity(int capacity) {
        if (capacity < 1) {
            return Validated.invalid("capacity", "Capacity must be at least 1 but was " + capacity);
        }
        return Validated.valid(capacity);
    }

    /**
     * 저장소 데이터로부터 복원
     *
     * @throws IllegalArgumentException 회장이 members에 중복으로 포함된 경우
     */
    public static Circle reconstruct(CircleId id, String name, Member owner, int capacity, List<Member> members) {
        if (members == null) {
            members = List.of();
        }
        if (owner.id().isAssigned()
                && members.stream().anyMatch(member -> member.id().equals(owner.id()))) {
            throw new IllegalArgumentException(
                    String.format("Owner must not be listed among members: circleId=%s, ownerId=%s", id, owner.id()));
        }
        return new Circle(id, name, capacity, owner, members);
    }

    /**
     * 회원 추가
     *
     * @return 정원을 초과하면 검증 실패
     */
    public Validated<Circle> addMember(Member member) {
        if (member == null) {
            return Validated.invalid("member", "Member cannot be null");
        }
        if (size() + 1 > capacity) {
            return Validated.invalid("capacity",
                    String.format("Circle is full: capacity=%d, current=%d", capacity, size()));
        }
        List<Member> next = new ArrayList<>(members);
        next.add(member);
        return Validated.valid(new Circle(id, name, capacity, owner, next));
    }

    /**
     * 이름/정원 부분 수정
     * null인 항목은 기존 값을 유지한다
     *
     * @return 이름이 비었거나 정원이 현재 인원보다 작으면 검증 실패
     */
    public Validated<Circle> update(String newName, Integer newCapacity) {
        String nextName = newName == null ? name : newName;
        int nextCapacity = newCapacity == null ? capacity : newCapacity;

        return validateName(nextName)
                .<Circle>flatMap(validName -> validateCapacity(nextCapacity)
                        .<Circle>flatMap(validCapacity -> {
                            if (validCapacity < size()) {
                                return Validated.invalid("capacity", String.format(
                                        "Capacity %d is smaller than current member count %d", validCapacity, size()));
                            }
                            return Validated.valid(new Circle(id, validName, validCapacity, owner, members));
                        }));
    }

    /**
     * 회장 포함 인원 수
     */
    public int size() {
        return members.size() + 1;
    }
}
