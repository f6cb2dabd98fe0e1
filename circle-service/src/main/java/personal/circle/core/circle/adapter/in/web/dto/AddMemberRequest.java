package personal.circle.core.circle.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.circle.core.circle.application.port.in.AddMemberCommand;
import personal.circle.core.circle.domain.model.CircleId;

/**
 * 회원 추가 요청 DTO
 */
public record AddMemberRequest(
        @NotNull(message = "name은 필수입니다.")
        String name,

        @NotNull(message = "age는 필수입니다.")
        Integer age,

        @NotNull(message = "grade는 필수입니다.")
        Integer grade,

        @NotNull(message = "major는 필수입니다.")
        String major
) {
    public AddMemberCommand toCommand(long circleId) {
        return new AddMemberCommand(CircleId.of(circleId), name, age, grade, major);
    }
}
