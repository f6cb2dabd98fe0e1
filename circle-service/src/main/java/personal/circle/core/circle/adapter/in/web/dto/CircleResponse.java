package personal.circle.core.circle.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import personal.circle.core.circle.domain.model.Circle;

import java.util.List;

/**
 * 동아리 조회 응답 DTO
 * members에는 회장이 포함되지 않는다
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"circle_id", "circle_name", "capacity", "owner", "members"})
public record CircleResponse(
        long circleId,
        String circleName,
        int capacity,
        MemberResponse owner,
        List<MemberResponse> members
) {
    public static CircleResponse from(Circle circle) {
        return new CircleResponse(
                circle.id().value(),
                circle.name(),
                circle.capacity(),
                MemberResponse.from(circle.owner()),
                circle.members().stream()
                        .map(MemberResponse::from)
                        .toList()
        );
    }
}
