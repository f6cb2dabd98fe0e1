package personal.circle.core.circle.domain.model;

import personal.circle.common.validation.Validated;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Major Enum
 * 전공 (표시명으로 저장/응답)
 */
public enum Major {
    MATH("Math"),
    ENGLISH("English"),
    MUSIC("Music"),
    ART("Art"),
    SCIENCE("Science"),
    LITERATURE("Literature"),
    SPORTS("Sports"),
    OTHER("Other");

    private final String label;

    Major(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 표시명으로 전공 조회 (대소문자 무시)
     *
     * @param raw 전공명 (예: "Music", "math")
     * @return 알 수 없는 전공이면 major 필드 검증 실패
     */
    public static Validated<Major> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Validated.invalid("major", "Major cannot be null or blank");
        }
        String candidate = raw.trim();
        return Arrays.stream(values())
                .filter(major -> major.label.equalsIgnoreCase(candidate))
                .findFirst()
                .<Validated<Major>>map(Validated::valid)
                .orElseGet(() -> Validated.invalid("major",
                        String.format("Unknown major '%s' (expected one of %s)", candidate, labels())));
    }

    private static String labels() {
        return Arrays.stream(values())
                .map(Major::label)
                .collect(Collectors.joining(", "));
    }
}
