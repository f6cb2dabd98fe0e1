package personal.circle.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Circle Domain (2xxx)
    CIRCLE_NOT_FOUND(HttpStatus.NOT_FOUND, "CL001", "Circle not found"),
    CIRCLE_DATA_INTEGRITY(HttpStatus.INTERNAL_SERVER_ERROR, "CL002", "Circle data integrity violated"),
    CIRCLE_STORE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "CL003", "Failed to access circle store");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
