package personal.circle.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param code    에러 코드 (예: "CL001")
 * @param message 클라이언트에 노출할 메시지
 */
public record ErrorResponse(
        String code,
        String message
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message);
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }
}
