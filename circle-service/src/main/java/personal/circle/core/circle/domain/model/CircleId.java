package personal.circle.core.circle.domain.model;

/**
 * Circle Identifier
 * 0 이하의 값은 아직 저장되지 않은 동아리를 의미한다
 */
public record CircleId(long value) implements Comparable<CircleId> {

    private static final CircleId UNASSIGNED = new CircleId(0L);

    public static CircleId of(long value) {
        return new CircleId(value);
    }

    public static CircleId unassigned() {
        return UNASSIGNED;
    }

    public boolean isAssigned() {
        return value > 0;
    }

    @Override
    public int compareTo(CircleId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
