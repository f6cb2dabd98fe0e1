package personal.circle.core.circle.domain.exception;

import personal.circle.common.exception.BusinessException;
import personal.circle.common.exception.ErrorCode;
import personal.circle.core.circle.domain.model.CircleId;

/**
 * Circle Data Integrity Exception
 * 저장된 동아리 행 집합이 집합체로 복원될 수 없을 때 발생 (회장 행 누락 등)
 */
public class CircleDataIntegrityException extends BusinessException {

    private final CircleId circleId;

    public CircleDataIntegrityException(CircleId circleId, String detail) {
        super(ErrorCode.CIRCLE_DATA_INTEGRITY, String.format("%s: circleId=%s", detail, circleId));
        this.circleId = circleId;
    }

    public static CircleDataIntegrityException ownerNotFound(CircleId circleId, long ownerId) {
        return new CircleDataIntegrityException(circleId, "Owner not found (ownerId=" + ownerId + ")");
    }

    public CircleId getCircleId() {
        return circleId;
    }
}
