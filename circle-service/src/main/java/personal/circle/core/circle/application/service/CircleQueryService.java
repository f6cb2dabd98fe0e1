package personal.circle.core.circle.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.circle.core.circle.application.port.in.GetCircleUseCase;
import personal.circle.core.circle.application.port.out.CircleRepository;
import personal.circle.core.circle.domain.exception.CircleNotFoundException;
import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;

/**
 * Circle Query Service (SRP)
 * 단일 책임: 동아리 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CircleQueryService implements GetCircleUseCase {

    private final CircleRepository circleRepository;

    @Override
    public Circle getCircle(CircleId circleId) {
        var circle = circleRepository.findById(circleId)
                .orElseThrow(() -> {
                    log.warn("Circle not found: circleId={}", circleId);
                    return new CircleNotFoundException(circleId);
                });

        log.debug("Circle retrieved: circleId={}, members={}", circleId, circle.members().size());

        return circle;
    }
}
