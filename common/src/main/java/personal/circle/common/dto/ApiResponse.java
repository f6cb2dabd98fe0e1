package personal.circle.common.dto;

/**
 * 공통 API 응답 포맷
 *
 * @param result  응답 결과 ("success" 또는 "error")
 * @param message 응답 메시지
 * @param data    응답 데이터 (제네릭 타입)
 * @param <T>     데이터 타입
 */
public record ApiResponse<T>(
        String result,
        String message,
        T data
) {
    /**
     * 성공 응답 생성
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>("success", message, data);
    }

    /**
     * 실패 응답 생성
     */
    public static <T> ApiResponse<T> error(String message, T data) {
        return new ApiResponse<>("error", message, data);
    }
}
