package personal.circle.core.circle.domain.model;

import personal.circle.common.validation.Validated;

import java.util.Objects;

/**
 * Member Domain Model
 * 동아리 회원 도메인 모델 (불변)
 */
public record Member(
        MemberId id,
        String name,
        int age,
        Grade grade,
        Major major
) {
    public Member {
        Objects.requireNonNull(id, "Member ID cannot be null");
        Objects.requireNonNull(grade, "Member grade cannot be null");
        Objects.requireNonNull(major, "Member major cannot be null");
    }

    /**
     * 신규 회원 생성 (정적 팩토리 메서드)
     *
     * @return 이름이 비었거나 나이가 양수가 아니면 검증 실패
     */
    public static Validated<Member> create(String name, int age, Grade grade, Major major) {
        if (name == null || name.isBlank()) {
            return Validated.invalid("name", "Member name cannot be null or blank");
        }
        if (age <= 0) {
            return Validated.invalid("age", "Member age must be positive but was " + age);
        }
        return Validated.valid(new Member(MemberId.unassigned(), name, age, grade, major));
    }

    /**
     * 저장소 데이터로부터 복원 (검증 생략)
     */
    public static Member reconstruct(MemberId id, String name, int age, Grade grade, Major major) {
        return new Member(id, name, age, grade, major);
    }
}
