package personal.circle.core.circle.application.port.in;

import personal.circle.core.circle.domain.model.CircleId;

import java.util.Objects;

/**
 * Add Member Command
 * 동아리 회원 추가 커맨드 (요청 원시값)
 */
public record AddMemberCommand(
        CircleId circleId,
        String name,
        int age,
        int grade,
        String major
) {
    public AddMemberCommand {
        Objects.requireNonNull(circleId, "Circle ID cannot be null");
    }
}
