package personal.circle.core.circle.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.circle.common.validation.Validated;
import personal.circle.core.circle.application.port.in.AddMemberCommand;
import personal.circle.core.circle.application.port.in.AddMemberUseCase;
import personal.circle.core.circle.application.port.in.CreateCircleCommand;
import personal.circle.core.circle.application.port.in.CreateCircleResult;
import personal.circle.core.circle.application.port.in.CreateCircleUseCase;
import personal.circle.core.circle.application.port.in.DeleteCircleUseCase;
import personal.circle.core.circle.application.port.in.UpdateCircleCommand;
import personal.circle.core.circle.application.port.in.UpdateCircleUseCase;
import personal.circle.core.circle.application.port.out.CircleRepository;
import personal.circle.core.circle.domain.exception.CircleNotFoundException;
import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;
import personal.circle.core.circle.domain.model.Grade;
import personal.circle.core.circle.domain.model.Major;
import personal.circle.core.circle.domain.model.Member;

/**
 * Circle Command Service
 * 동아리 생성/수정/삭제/회원 추가 유스케이스 구현
 * <p>
 * 원시 입력값은 도메인 검증을 모두 통과한 뒤에만 저장소로 전달된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CircleCommandService implements CreateCircleUseCase, UpdateCircleUseCase,
        DeleteCircleUseCase, AddMemberUseCase {

    private final CircleRepository circleRepository;

    @Override
    @Transactional
    public CreateCircleResult createCircle(CreateCircleCommand command) {
        Validated<Circle> validated = newMember(
                command.ownerName(), command.ownerAge(), command.ownerGrade(), command.ownerMajor())
                .flatMap(owner -> Circle.create(command.circleName(), command.capacity(), owner));
        Circle circle = requireValid(validated, "createCircle");

        Circle created = circleRepository.create(circle);

        log.info("Circle created: circleId={}, ownerId={}", created.id(), created.owner().id());
        return new CreateCircleResult(created.id(), created.owner().id());
    }

    @Override
    @Transactional
    public CircleId updateCircle(UpdateCircleCommand command) {
        // 저장된 구성원과 무관한 규칙은 조회 전에 확인한다
        if (command.circleName() != null) {
            requireValid(Circle.validateName(command.circleName()), "updateCircle");
        }
        if (command.capacity() != null) {
            requireValid(Circle.validateCapacity(command.capacity()), "updateCircle");
        }
        Circle circle = loadCircle(command.circleId());

        Circle updated = requireValid(circle.update(command.circleName(), command.capacity()), "updateCircle");
        circleRepository.update(updated);

        log.info("Circle updated: circleId={}, name={}, capacity={}",
                updated.id(), updated.name(), updated.capacity());
        return updated.id();
    }

    @Override
    @Transactional
    public void deleteCircle(CircleId circleId) {
        if (!circleRepository.deleteById(circleId)) {
            log.warn("Circle not found: circleId={}", circleId);
            throw new CircleNotFoundException(circleId);
        }
        log.info("Circle deleted: circleId={}", circleId);
    }

    @Override
    @Transactional
    public Circle addMember(AddMemberCommand command) {
        Validated<Member> member = newMember(command.name(), command.age(), command.grade(), command.major());
        Member validMember = requireValid(member, "addMember");

        Circle circle = loadCircle(command.circleId());
        Circle joined = requireValid(circle.addMember(validMember), "addMember");

        Circle saved = circleRepository.update(joined);
        log.info("Member added: circleId={}, size={}/{}", saved.id(), saved.size(), saved.capacity());
        return saved;
    }

    private Validated<Member> newMember(String name, int age, int grade, String major) {
        return Grade.of(grade)
                .flatMap(validGrade -> Major.parse(major)
                        .flatMap(validMajor -> Member.create(name, age, validGrade, validMajor)));
    }

    private Circle loadCircle(CircleId circleId) {
        return circleRepository.findById(circleId)
                .orElseThrow(() -> {
                    log.warn("Circle not found: circleId={}", circleId);
                    return new CircleNotFoundException(circleId);
                });
    }

    private <T> T requireValid(Validated<T> validated, String operation) {
        if (!validated.isValid()) {
            validated.error().ifPresent(error ->
                    log.warn("Rejected {}: {}", operation, error));
        }
        return validated.orElseThrow();
    }
}
