package personal.circle.core.circle.domain.exception;

import personal.circle.common.exception.BusinessException;
import personal.circle.common.exception.ErrorCode;

/**
 * Circle Store Exception
 * 저장소 연결/쿼리 실패를 감싸는 예외. 원인은 로그로만 남기고 호출자에게는 일반 실패로 전달한다
 */
public class CircleStoreException extends BusinessException {

    private final String operation;

    public CircleStoreException(String operation, Throwable cause) {
        super(ErrorCode.CIRCLE_STORE_ERROR, "Circle store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
