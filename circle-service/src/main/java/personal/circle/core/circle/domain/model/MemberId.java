package personal.circle.core.circle.domain.model;

/**
 * Member Identifier
 * 0 이하의 값은 아직 저장되지 않은 회원을 의미한다
 */
public record MemberId(long value) implements Comparable<MemberId> {

    private static final MemberId UNASSIGNED = new MemberId(0L);

    public static MemberId of(long value) {
        return new MemberId(value);
    }

    public static MemberId unassigned() {
        return UNASSIGNED;
    }

    public boolean isAssigned() {
        return value > 0;
    }

    @Override
    public int compareTo(MemberId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
