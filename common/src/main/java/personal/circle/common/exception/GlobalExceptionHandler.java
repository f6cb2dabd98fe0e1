package personal.circle.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import personal.circle.common.validation.ValidationException;

/**
 * 전역 예외 처리 핸들러
 * BusinessException은 ErrorCode의 상태 코드로, 그 외 예외는 500으로 변환한다
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

        @ExceptionHandler(ValidationException.class)
        public ResponseEntity<ErrorResponse> handleValidationException(ValidationException e) {
                log.warn("Domain validation failed: field={}, message={}",
                                e.getValidationError().field(), e.getValidationError().message());

                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, e.getMessage());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(BusinessException.class)
        public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
                ErrorCode errorCode = e.getErrorCode();
                if (errorCode.getHttpStatus().is5xxServerError()) {
                        log.error("Business exception occurred: code={}, detail={}",
                                        errorCode.getCode(), e.getMessage(), e);
                } else {
                        log.warn("Business exception occurred: code={}, message={}, detail={}",
                                        errorCode.getCode(), errorCode.getMessage(), e.getMessage());
                }

                ErrorResponse response = ErrorResponse.of(errorCode);
                return ResponseEntity
                                .status(errorCode.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(NoResourceFoundException.class)
        public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
                log.warn("Resource not found: {}", e.getResourcePath());

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.NOT_FOUND,
                                "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath());
                return ResponseEntity
                                .status(ErrorCode.NOT_FOUND.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(MethodArgumentNotValidException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
                log.warn("Validation failed: {}", e.getMessage());
                String message = ErrorCode.INVALID_INPUT.getMessage();
                if (!e.getBindingResult().getAllErrors().isEmpty()) {
                        message = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
                }
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, message);
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(HttpMessageNotReadableException.class)
        public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
                log.warn("Malformed request body: {}", e.getMessage());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, "요청 본문을 읽을 수 없습니다.");
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(MethodArgumentTypeMismatchException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(
                        MethodArgumentTypeMismatchException e) {
                log.warn("Type mismatch: parameter={}, value={}", e.getName(), e.getValue());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "파라미터 형식이 올바르지 않습니다: " + e.getName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(Exception.class)
        public ResponseEntity<ErrorResponse> handleException(Exception e) {
                log.error("Unexpected exception occurred", e);

                ErrorResponse response = ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR);
                return ResponseEntity
                                .status(ErrorCode.INTERNAL_SERVER_ERROR.getHttpStatus())
                                .body(response);
        }
}
