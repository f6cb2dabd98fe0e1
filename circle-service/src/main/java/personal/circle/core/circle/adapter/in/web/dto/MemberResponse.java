package personal.circle.core.circle.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import personal.circle.core.circle.domain.model.Member;

/**
 * 회원 응답 DTO
 */
@JsonPropertyOrder({"id", "name", "age", "grade", "major"})
public record MemberResponse(
        long id,
        String name,
        int age,
        int grade,
        String major
) {
    public static MemberResponse from(Member member) {
        return new MemberResponse(
                member.id().value(),
                member.name(),
                member.age(),
                member.grade().value(),
                member.major().label()
        );
    }
}
