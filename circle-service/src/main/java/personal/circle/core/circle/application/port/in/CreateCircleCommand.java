package personal.circle.core.circle.application.port.in;

/**
 * Create Circle Command
 * 동아리 생성 커맨드 (요청 원시값)
 */
public record CreateCircleCommand(
        String circleName,
        int capacity,
        String ownerName,
        int ownerAge,
        int ownerGrade,
        String ownerMajor
) {
}
