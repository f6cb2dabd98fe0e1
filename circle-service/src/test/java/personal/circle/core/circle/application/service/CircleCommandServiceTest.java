package personal.circle.core.circle.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.circle.common.exception.ErrorCode;
import personal.circle.common.validation.ValidationException;
import personal.circle.core.circle.application.port.in.AddMemberCommand;
import personal.circle.core.circle.application.port.in.CreateCircleCommand;
import personal.circle.core.circle.application.port.in.CreateCircleResult;
import personal.circle.core.circle.application.port.in.UpdateCircleCommand;
import personal.circle.core.circle.application.port.out.CircleRepository;
import personal.circle.core.circle.domain.exception.CircleNotFoundException;
import personal.circle.core.circle.domain.model.Circle;
import personal.circle.core.circle.domain.model.CircleId;
import personal.circle.core.circle.domain.model.Grade;
import personal.circle.core.circle.domain.model.Major;
import personal.circle.core.circle.domain.model.Member;
import personal.circle.core.circle.domain.model.MemberId;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("CircleCommandService 단위 테스트")
class CircleCommandServiceTest {

    private static final CircleId CIRCLE_ID = CircleId.of(10L);
    private static final MemberId OWNER_ID = MemberId.of(1L);

    @Mock
    private CircleRepository circleRepository;
    @InjectMocks
    private CircleCommandService circleCommandService;
    private Circle savedCircle;

    @BeforeEach
    void setUp() {
        Member owner = Member.reconstruct(OWNER_ID, "John Lennon", 21, Grade.of(3).orElseThrow(), Major.MUSIC);
        savedCircle = Circle.reconstruct(CIRCLE_ID, "Music club", owner, 2, List.of());
    }

    @Test
    @DisplayName("동아리 생성 성공 - 검증된 집합체가 저장되고 발급된 ID를 반환한다")
    void createCircle_Success() {
        // given
        CreateCircleCommand command = new CreateCircleCommand("Music club", 2, "John Lennon", 21, 3, "music");
        given(circleRepository.create(any(Circle.class))).willReturn(savedCircle);

        // when
        CreateCircleResult result = circleCommandService.createCircle(command);

        // then
        assertThat(result.circleId()).isEqualTo(CIRCLE_ID);
        assertThat(result.ownerId()).isEqualTo(OWNER_ID);

        ArgumentCaptor<Circle> captor = ArgumentCaptor.forClass(Circle.class);
        verify(circleRepository).create(captor.capture());
        Circle requested = captor.getValue();
        assertThat(requested.id().isAssigned()).isFalse();
        assertThat(requested.name()).isEqualTo("Music club");
        assertThat(requested.owner().major()).isEqualTo(Major.MUSIC);
        assertThat(requested.members()).isEmpty();
    }

    @Test
    @DisplayName("동아리 생성 실패 - 회장 학년이 범위를 벗어나면 저장소에 접근하지 않는다")
    void createCircle_InvalidGrade() {
        // given
        CreateCircleCommand command = new CreateCircleCommand("Music club", 10, "John Lennon", 21, 7, "Music");

        // when & then
        assertThatThrownBy(() -> circleCommandService.createCircle(command))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("grade:")
                .satisfies(e -> assertThat(((ValidationException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));
        verify(circleRepository, never()).create(any());
    }

    @Test
    @DisplayName("동아리 생성 실패 - 정원이 0이면 저장소에 접근하지 않는다")
    void createCircle_ZeroCapacity() {
        CreateCircleCommand command = new CreateCircleCommand("Music club", 0, "John Lennon", 21, 3, "Music");

        assertThatThrownBy(() -> circleCommandService.createCircle(command))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("capacity:");
        verify(circleRepository, never()).create(any());
    }

    @Test
    @DisplayName("동아리 수정 성공 - 바뀐 이름과 정원으로 저장한다")
    void updateCircle_Success() {
        // given
        given(circleRepository.findById(CIRCLE_ID)).willReturn(Optional.of(savedCircle));
        given(circleRepository.update(any(Circle.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        CircleId result = circleCommandService.updateCircle(
                new UpdateCircleCommand(CIRCLE_ID, "Football club", 20));

        // then
        assertThat(result).isEqualTo(CIRCLE_ID);
        ArgumentCaptor<Circle> captor = ArgumentCaptor.forClass(Circle.class);
        verify(circleRepository).update(captor.capture());
        assertThat(captor.getValue().name()).isEqualTo("Football club");
        assertThat(captor.getValue().capacity()).isEqualTo(20);
        assertThat(captor.getValue().owner()).isEqualTo(savedCircle.owner());
    }

    @Test
    @DisplayName("동아리 수정 실패 - 동아리 없음")
    void updateCircle_NotFound() {
        // given
        given(circleRepository.findById(CIRCLE_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> circleCommandService.updateCircle(new UpdateCircleCommand(CIRCLE_ID, "x", 5)))
                .isInstanceOf(CircleNotFoundException.class)
                .hasMessageContaining("Circle not found")
                .hasMessageContaining("10");
        verify(circleRepository, never()).update(any());
    }

    @Test
    @DisplayName("동아리 수정 실패 - 정원을 현재 인원보다 줄일 수 없다")
    void updateCircle_CapacityBelowSize() {
        // given
        Circle full = savedCircle.addMember(
                Member.reconstruct(MemberId.of(2L), "Paul McCartney", 22, Grade.of(2).orElseThrow(), Major.ART))
                .orElseThrow();
        given(circleRepository.findById(CIRCLE_ID)).willReturn(Optional.of(full));

        // when & then
        assertThatThrownBy(() -> circleCommandService.updateCircle(new UpdateCircleCommand(CIRCLE_ID, null, 1)))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("capacity:");
        verify(circleRepository, never()).update(any());
    }

    @Test
    @DisplayName("동아리 수정 실패 - 빈 이름은 동아리를 조회하기 전에 거부한다")
    void updateCircle_BlankNameRejectedBeforeLoad() {
        assertThatThrownBy(() -> circleCommandService.updateCircle(new UpdateCircleCommand(CIRCLE_ID, " ", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("circle_name:");
        verify(circleRepository, never()).findById(any());
        verify(circleRepository, never()).update(any());
    }

    @Test
    @DisplayName("동아리 수정 실패 - 1 미만의 정원은 동아리를 조회하기 전에 거부한다")
    void updateCircle_ZeroCapacityRejectedBeforeLoad() {
        assertThatThrownBy(() -> circleCommandService.updateCircle(new UpdateCircleCommand(CIRCLE_ID, null, 0)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("capacity: Capacity must be at least 1 but was 0");
        verify(circleRepository, never()).findById(any());
    }

    @Test
    @DisplayName("동아리 삭제 성공 - 집합체를 복원하지 않고 ID로 삭제한다")
    void deleteCircle_Success() {
        // given
        given(circleRepository.deleteById(CIRCLE_ID)).willReturn(true);

        // when
        circleCommandService.deleteCircle(CIRCLE_ID);

        // then
        verify(circleRepository).deleteById(CIRCLE_ID);
        verify(circleRepository, never()).findById(any());
    }

    @Test
    @DisplayName("동아리 삭제 실패 - 동아리 없음")
    void deleteCircle_NotFound() {
        given(circleRepository.deleteById(CIRCLE_ID)).willReturn(false);

        assertThatThrownBy(() -> circleCommandService.deleteCircle(CIRCLE_ID))
                .isInstanceOf(CircleNotFoundException.class)
                .hasMessageContaining("Circle not found");
    }

    @Test
    @DisplayName("회원 추가 성공 - 새 회원이 포함된 집합체를 저장한다")
    void addMember_Success() {
        // given
        given(circleRepository.findById(CIRCLE_ID)).willReturn(Optional.of(savedCircle));
        given(circleRepository.update(any(Circle.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        Circle result = circleCommandService.addMember(
                new AddMemberCommand(CIRCLE_ID, "Paul McCartney", 22, 2, "Art"));

        // then
        assertThat(result.members()).singleElement().satisfies(member -> {
            assertThat(member.name()).isEqualTo("Paul McCartney");
            assertThat(member.major()).isEqualTo(Major.ART);
            assertThat(member.id().isAssigned()).isFalse();
        });
        assertThat(result.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("회원 추가 실패 - 정원이 가득 찼다")
    void addMember_Full() {
        // given
        Circle full = Circle.reconstruct(CIRCLE_ID, "Music club", savedCircle.owner(), 1, List.of());
        given(circleRepository.findById(CIRCLE_ID)).willReturn(Optional.of(full));

        // when & then
        assertThatThrownBy(() -> circleCommandService.addMember(
                new AddMemberCommand(CIRCLE_ID, "Paul McCartney", 22, 2, "Art")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Circle is full");
        verify(circleRepository, never()).update(any());
    }

    @Test
    @DisplayName("회원 추가 실패 - 알 수 없는 전공이면 동아리를 조회하지 않는다")
    void addMember_UnknownMajor() {
        assertThatThrownBy(() -> circleCommandService.addMember(
                new AddMemberCommand(CIRCLE_ID, "Paul McCartney", 22, 2, "Alchemy")))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("major:");
        verify(circleRepository, never()).findById(any());
    }
}
