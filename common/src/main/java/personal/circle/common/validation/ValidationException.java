package personal.circle.common.validation;

import personal.circle.common.exception.BusinessException;
import personal.circle.common.exception.ErrorCode;

/**
 * Validation Exception
 * 실패한 {@link Validated}를 예외 흐름으로 전환할 때 발생
 */
public class ValidationException extends BusinessException {

    private final ValidationError validationError;

    public ValidationException(ValidationError validationError) {
        super(ErrorCode.INVALID_INPUT, validationError.toString());
        this.validationError = validationError;
    }

    public ValidationError getValidationError() {
        return validationError;
    }
}
