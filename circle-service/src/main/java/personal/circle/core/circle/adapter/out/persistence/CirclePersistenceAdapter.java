package personal.circle.core.circle.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.circle.core.circle.application.port.out.CircleRepository;
import personal.circle.core.circle.domain.exception.CircleNotFoundException;
import personal.circle.core.circle.domain.exception.CircleStoreException;
import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Circle Persistence Adapter
 * JPA를 사용한 동아리 집합체 저장소 구현체
 * <p>
 * 동아리 1건은 circles 행 1건과 members 행 N+1건(회장 포함)으로 저장된다.
 * 생성/수정/삭제는 각각 하나의 트랜잭션으로 실행되어 일부 행만 반영되는 일이 없다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CirclePersistenceAdapter implements CircleRepository {

    private final JpaCircleRepository jpaCircleRepository;
    private final JpaMemberRepository jpaMemberRepository;
    private final CircleRowMapper circleRowMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Circle> findById(CircleId circleId) {
        log.debug("Finding circle by id: {}", circleId);
        try {
            Optional<CircleEntity> circleRow = jpaCircleRepository.findById(circleId.value());
            if (circleRow.isEmpty()) {
                return Optional.empty();
            }
            List<MemberEntity> memberRows = jpaMemberRepository.findByCircleIdOrderByIdAsc(circleId.value());
            return Optional.of(circleRowMapper.toDomain(new CircleRows(circleRow.get(), memberRows)));
        } catch (DataAccessException e) {
            throw storeFailure("findById", circleId, e);
        }
    }

    @Override
    @Transactional
    public Circle create(Circle circle) {
        CircleRows rows = circleRowMapper.toRows(circle);
        log.debug("Creating circle: name={}, members={}", circle.name(), rows.members().size());
        try {
            // owner_id는 회장 행 삽입 후에 확정된다
            CircleEntity circleRow = jpaCircleRepository.save(CircleEntity.of(
                    null, rows.circle().getName(), CircleEntity.PENDING_OWNER_ID, rows.circle().getCapacity()));
            Long circleId = circleRow.getId();

            List<MemberEntity> memberRows = insertMemberRows(rows, circleId);
            circleRow.assignOwner(memberRows.get(0).getId());
            jpaCircleRepository.flush();

            log.debug("Circle rows inserted: circleId={}, ownerId={}, memberRows={}",
                    circleId, circleRow.getOwnerId(), memberRows.size());
            return circleRowMapper.toDomain(new CircleRows(circleRow, memberRows));
        } catch (DataAccessException e) {
            throw storeFailure("create", circle.id(), e);
        }
    }

    @Override
    @Transactional
    public Circle update(Circle circle) {
        Long circleId = circle.id().value();
        log.debug("Updating circle: circleId={}", circleId);
        try {
            CircleEntity circleRow = jpaCircleRepository.findById(circleId)
                    .orElseThrow(() -> new CircleNotFoundException(circle.id()));
            CircleRows rows = circleRowMapper.toRows(circle);

            circleRow.updateDetails(circle.name(), circle.capacity());
            int deleted = jpaMemberRepository.deleteByCircleId(circleId);

            List<MemberEntity> memberRows = insertMemberRows(rows, circleId);
            circleRow.assignOwner(memberRows.get(0).getId());
            CircleEntity saved = jpaCircleRepository.saveAndFlush(circleRow);

            log.debug("Circle rows replaced: circleId={}, deletedMembers={}, insertedMembers={}",
                    circleId, deleted, memberRows.size());
            return circleRowMapper.toDomain(new CircleRows(saved, memberRows));
        } catch (DataAccessException e) {
            throw storeFailure("update", circle.id(), e);
        }
    }

    @Override
    @Transactional
    public void delete(Circle circle) {
        deleteById(circle.id());
    }

    @Override
    @Transactional
    public boolean deleteById(CircleId circleId) {
        Long id = circleId.value();
        log.debug("Deleting circle: circleId={}", circleId);
        try {
            if (!jpaCircleRepository.existsById(id)) {
                return false;
            }
            // 회원 행이 circles 행을 참조하므로 회원 행을 먼저 지운다
            int deleted = jpaMemberRepository.deleteByCircleId(id);
            jpaCircleRepository.deleteById(id);
            jpaCircleRepository.flush();
            log.debug("Circle rows deleted: circleId={}, deletedMembers={}", circleId, deleted);
            return true;
        } catch (DataAccessException e) {
            throw storeFailure("delete", circleId, e);
        }
    }

    /**
     * 회장 행부터 순서대로 삽입. ID가 있는 행은 그 ID를 유지하고, 없는 행은 새로 발급받는다.
     *
     * @return 삽입된 행 (회장 행이 첫 번째)
     */
    private List<MemberEntity> insertMemberRows(CircleRows rows, Long circleId) {
        List<MemberEntity> inserted = new ArrayList<>(rows.members().size());
        for (MemberEntity row : rows.members()) {
            MemberEntity tagged = row.forCircle(circleId);
            if (tagged.getId() == null) {
                inserted.add(jpaMemberRepository.save(tagged));
            } else {
                jpaMemberRepository.insertWithId(tagged.getId(), tagged.getName(), tagged.getAge(),
                        tagged.getGrade(), tagged.getMajor(), circleId);
                inserted.add(tagged);
            }
        }
        return inserted;
    }

    private CircleStoreException storeFailure(String operation, CircleId circleId, DataAccessException e) {
        log.error("Circle store operation failed: operation={}, circleId={}", operation, circleId, e);
        return new CircleStoreException(operation, e);
    }
}
