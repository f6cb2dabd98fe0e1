package personal.circle.core.circle.domain.model;

import personal.circle.common.validation.Validated;

/**
 * Grade Value Object
 * 학년 (1~4)
 */
public record Grade(int value) {

    public static final int MIN = 1;
    public static final int MAX = 4;

    public Grade {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException(
                    String.format("Grade must be between %d and %d: %d", MIN, MAX, value));
        }
    }

    /**
     * 학년 생성
     *
     * @param value 학년 값
     * @return 범위를 벗어나면 grade 필드 검증 실패
     */
    public static Validated<Grade> of(int value) {
        if (value < MIN || value > MAX) {
            return Validated.invalid("grade",
                    String.format("Grade must be between %d and %d but was %d", MIN, MAX, value));
        }
        return Validated.valid(new Grade(value));
    }
}
