package personal.circle.core.circle.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import personal.circle.common.validation.Validated;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Circle 도메인 모델 단위 테스트")
class CircleTest {

    private static final Grade GRADE = Grade.of(3).orElseThrow();

    private static Member owner() {
        return Member.reconstruct(MemberId.of(1L), "John Lennon", 21, GRADE, Major.MUSIC);
    }

    private static Member member(long id, String name) {
        return Member.reconstruct(MemberId.of(id), name, 20, GRADE, Major.MUSIC);
    }

    private static Circle savedCircle(int capacity, Member... members) {
        return Circle.reconstruct(CircleId.of(10L), "Music club", owner(), capacity, List.of(members));
    }

    @Nested
    @DisplayName("동아리 생성")
    class Create {

        @Test
        @DisplayName("회장만 있는 동아리가 생성된다")
        void create_Success() {
            // when
            Validated<Circle> circle = Circle.create("Music club", 10, owner());

            // then
            Circle created = circle.orElseThrow();
            assertThat(created.id().isAssigned()).isFalse();
            assertThat(created.name()).isEqualTo("Music club");
            assertThat(created.capacity()).isEqualTo(10);
            assertThat(created.members()).isEmpty();
            assertThat(created.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("정원이 1 미만이면 capacity 필드 검증 실패")
        void create_ZeroCapacity() {
            Validated<Circle> circle = Circle.create("Music club", 0, owner());

            assertThat(circle.error()).hasValueSatisfying(error -> assertThat(error.field()).isEqualTo("capacity"));
        }

        @Test
        @DisplayName("이름이 비어 있으면 circle_name 필드 검증 실패")
        void create_BlankName() {
            Validated<Circle> circle = Circle.create("", 10, owner());

            assertThat(circle.error()).hasValueSatisfying(error -> assertThat(error.field()).isEqualTo("circle_name"));
        }

        @Test
        @DisplayName("정원 1이면 회장만으로 가득 찬다")
        void create_CapacityOne() {
            Circle circle = Circle.create("Solo club", 1, owner()).orElseThrow();

            assertThat(circle.addMember(member(2L, "Paul McCartney")).isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("회원 추가")
    class AddMember {

        @Test
        @DisplayName("정원 이내면 새 동아리에 회원이 추가되고 원본은 변하지 않는다")
        void addMember_Success() {
            // given
            Circle circle = savedCircle(3);
            Member newMember = member(2L, "Paul McCartney");

            // when
            Circle joined = circle.addMember(newMember).orElseThrow();

            // then
            assertThat(joined.members()).containsExactly(newMember);
            assertThat(joined.size()).isEqualTo(2);
            assertThat(circle.members()).isEmpty();
        }

        @Test
        @DisplayName("정원이 가득 차면 capacity 필드 검증 실패")
        void addMember_Full() {
            // given
            Circle circle = savedCircle(2, member(2L, "Paul McCartney"));

            // when
            Validated<Circle> result = circle.addMember(member(3L, "George Harrison"));

            // then
            assertThat(result.error()).hasValueSatisfying(error -> {
                assertThat(error.field()).isEqualTo("capacity");
                assertThat(error.message()).isEqualTo("Circle is full: capacity=2, current=2");
            });
        }
    }

    @Nested
    @DisplayName("동아리 수정")
    class Update {

        @Test
        @DisplayName("이름과 정원을 함께 수정한다")
        void update_NameAndCapacity() {
            Circle updated = savedCircle(10).update("Football club", 20).orElseThrow();

            assertThat(updated.name()).isEqualTo("Football club");
            assertThat(updated.capacity()).isEqualTo(20);
            assertThat(updated.id()).isEqualTo(CircleId.of(10L));
            assertThat(updated.owner()).isEqualTo(owner());
        }

        @Test
        @DisplayName("null 항목은 기존 값을 유지한다")
        void update_PartialKeepsValues() {
            Circle updated = savedCircle(10).update(null, 15).orElseThrow();

            assertThat(updated.name()).isEqualTo("Music club");
            assertThat(updated.capacity()).isEqualTo(15);
        }

        @Test
        @DisplayName("정원을 현재 인원보다 작게 줄일 수 없다")
        void update_CapacityBelowSize() {
            // given
            Circle circle = savedCircle(5, member(2L, "Paul McCartney"), member(3L, "George Harrison"));

            // when
            Validated<Circle> result = circle.update(null, 2);

            // then
            assertThat(result.error()).hasValueSatisfying(error -> {
                assertThat(error.field()).isEqualTo("capacity");
                assertThat(error.message()).isEqualTo("Capacity 2 is smaller than current member count 3");
            });
        }

        @Test
        @DisplayName("정원을 현재 인원과 같게 줄이는 것은 허용된다")
        void update_CapacityEqualsSize() {
            Circle circle = savedCircle(5, member(2L, "Paul McCartney"));

            assertThat(circle.update(null, 2).orElseThrow().capacity()).isEqualTo(2);
        }

        @Test
        @DisplayName("빈 이름으로 수정할 수 없다")
        void update_BlankName() {
            assertThat(savedCircle(10).update(" ", null).isValid()).isFalse();
        }

        @Test
        @DisplayName("정원을 1 미만으로 수정할 수 없다")
        void update_ZeroCapacity() {
            Circle circle = savedCircle(5);

            assertThat(circle.update(null, 0).error()).hasValueSatisfying(error -> {
                assertThat(error.field()).isEqualTo("capacity");
                assertThat(error.message()).isEqualTo("Capacity must be at least 1 but was 0");
            });
        }
    }

    @Nested
    @DisplayName("단독 규칙 검증")
    class StandaloneRules {

        @Test
        @DisplayName("이름은 null이나 공백일 수 없다")
        void validateName() {
            assertThat(Circle.validateName("Music club").orElseThrow()).isEqualTo("Music club");
            assertThat(Circle.validateName(null).isValid()).isFalse();
            assertThat(Circle.validateName("  ").error())
                    .hasValueSatisfying(error -> assertThat(error.field()).isEqualTo("circle_name"));
        }

        @Test
        @DisplayName("정원은 1 이상이어야 한다")
        void validateCapacity() {
            assertThat(Circle.validateCapacity(1).orElseThrow()).isEqualTo(1);
            assertThat(Circle.validateCapacity(-3).error())
                    .hasValueSatisfying(error -> assertThat(error.message())
                            .isEqualTo("Capacity must be at least 1 but was -3"));
        }
    }

    @Nested
    @DisplayName("저장소 복원")
    class Reconstruct {

        @Test
        @DisplayName("회장이 회원 목록에 포함되어 있으면 복원할 수 없다")
        void reconstruct_OwnerListedAsMember() {
            assertThatThrownBy(() -> Circle.reconstruct(
                    CircleId.of(10L), "Music club", owner(), 10, List.of(owner())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Owner must not be listed among members");
        }

        @Test
        @DisplayName("회원 목록은 외부에서 변경할 수 없다")
        void reconstruct_MembersImmutable() {
            Circle circle = savedCircle(10, member(2L, "Paul McCartney"));

            assertThatThrownBy(() -> circle.members().add(member(3L, "George Harrison")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("회원 목록이 null이면 빈 목록으로 복원된다")
        void reconstruct_NullMembers() {
            Circle circle = Circle.reconstruct(CircleId.of(10L), "Music club", owner(), 10, null);

            assertThat(circle.members()).isEmpty();
            assertThat(circle.size()).isEqualTo(1);
        }
    }
}
