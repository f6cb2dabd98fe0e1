package personal.circle.core.circle.adapter.in.web.dto;

/**
 * 동아리 수정 응답 DTO
 */
public record UpdateCircleResponse(
        long id
) {
}
