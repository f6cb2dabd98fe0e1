package personal.circle.core.circle.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.circle.core.circle.adapter.in.web.dto.AddMemberRequest;
import personal.circle.core.circle.adapter.in.web.dto.CircleResponse;
import personal.circle.core.circle.adapter.in.web.dto.CreateCircleRequest;
import personal.circle.core.circle.adapter.in.web.dto.CreateCircleResponse;
import personal.circle.core.circle.adapter.in.web.dto.UpdateCircleRequest;
import personal.circle.core.circle.adapter.in.web.dto.UpdateCircleResponse;
import personal.circle.core.circle.application.port.in.AddMemberUseCase;
import personal.circle.core.circle.application.port.in.CreateCircleResult;
import personal.circle.core.circle.application.port.in.CreateCircleUseCase;
import personal.circle.core.circle.application.port.in.DeleteCircleUseCase;
import personal.circle.core.circle.application.port.in.GetCircleUseCase;
import personal.circle.core.circle.application.port.in.UpdateCircleUseCase;
import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;

/**
 * Circle API Controller
 * 동아리 생성/조회/수정/삭제 및 회원 추가 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/circles")
@RequiredArgsConstructor
public class CircleController {

    private final CreateCircleUseCase createCircleUseCase;
    private final GetCircleUseCase getCircleUseCase;
    private final UpdateCircleUseCase updateCircleUseCase;
    private final DeleteCircleUseCase deleteCircleUseCase;
    private final AddMemberUseCase addMemberUseCase;

    /**
     * 동아리 생성
     * POST /api/v1/circles
     */
    @PostMapping
    public ResponseEntity<CreateCircleResponse> createCircle(@Valid @RequestBody CreateCircleRequest request) {
        log.info("Create circle: name={}, capacity={}", request.circleName(), request.capacity());

        CreateCircleResult result = createCircleUseCase.createCircle(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(CreateCircleResponse.from(result));
    }

    /**
     * 동아리 조회
     * GET /api/v1/circles/{circleId}
     */
    @GetMapping("/{circleId}")
    public ResponseEntity<CircleResponse> getCircle(@PathVariable long circleId) {
        log.info("Get circle: circleId={}", circleId);

        Circle circle = getCircleUseCase.getCircle(CircleId.of(circleId));

        return ResponseEntity.ok(CircleResponse.from(circle));
    }

    /**
     * 동아리 이름/정원 수정
     * PUT /api/v1/circles/{circleId}
     */
    @PutMapping("/{circleId}")
    public ResponseEntity<UpdateCircleResponse> updateCircle(
            @PathVariable long circleId,
            @RequestBody UpdateCircleRequest request
    ) {
        log.info("Update circle: circleId={}, name={}, capacity={}",
                circleId, request.circleName(), request.capacity());

        CircleId updated = updateCircleUseCase.updateCircle(request.toCommand(circleId));

        return ResponseEntity.ok(new UpdateCircleResponse(updated.value()));
    }

    /**
     * 동아리 삭제
     * DELETE /api/v1/circles/{circleId}
     */
    @DeleteMapping("/{circleId}")
    public ResponseEntity<Void> deleteCircle(@PathVariable long circleId) {
        log.info("Delete circle: circleId={}", circleId);

        deleteCircleUseCase.deleteCircle(CircleId.of(circleId));

        return ResponseEntity.noContent().build();
    }

    /**
     * 회원 추가
     * POST /api/v1/circles/{circleId}/members
     */
    @PostMapping("/{circleId}/members")
    public ResponseEntity<CircleResponse> addMember(
            @PathVariable long circleId,
            @Valid @RequestBody AddMemberRequest request
    ) {
        log.info("Add member: circleId={}, name={}", circleId, request.name());

        Circle circle = addMemberUseCase.addMember(request.toCommand(circleId));

        return ResponseEntity.status(HttpStatus.CREATED).body(CircleResponse.from(circle));
    }
}
