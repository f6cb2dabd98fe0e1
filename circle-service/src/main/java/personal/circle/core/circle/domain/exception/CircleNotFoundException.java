package personal.circle.core.circle.domain.exception;

import personal.circle.common.exception.BusinessException;
import personal.circle.common.exception.ErrorCode;
import personal.circle.core.circle.domain.model.CircleId;

/**
 * Circle Not Found Exception
 * 동아리를 찾을 수 없을 때 발생하는 예외
 */
public class CircleNotFoundException extends BusinessException {

    private final CircleId circleId;

    public CircleNotFoundException(CircleId circleId) {
        super(ErrorCode.CIRCLE_NOT_FOUND, String.format("Circle not found: circleId=%s", circleId));
        this.circleId = circleId;
    }

    public CircleId getCircleId() {
        return circleId;
    }
}
