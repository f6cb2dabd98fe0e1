package personal.circle.common.validation;

/**
 * 도메인 검증 실패 정보
 *
 * @param field   검증에 실패한 필드명
 * @param message 실패 사유
 */
public record ValidationError(
        String field,
        String message
) {
    public ValidationError {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Validation error field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Validation error message cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
