package personal.circle.core.circle.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Circle rows
 */
public interface JpaCircleRepository extends JpaRepository<CircleEntity, Long> {
}
