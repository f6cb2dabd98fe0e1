package personal.circle.common.validation;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 도메인 생성 결과
 * 검증에 성공한 값({@link Valid}) 또는 실패 사유({@link Invalid}) 중 하나를 담는다.
 * <p>
 * 생성 규칙 위반은 예외 대신 이 타입으로 반환되며, 호출자는 값을 사용하기 전에
 * {@link #isValid()}로 확인하거나 {@link #orElseThrow()}로 예외 흐름에 합류해야 한다.
 *
 * @param <T> 검증 대상 타입
 */
public sealed interface Validated<T> permits Validated.Valid, Validated.Invalid {

    static <T> Validated<T> valid(T value) {
        return new Valid<>(value);
    }

    static <T> Validated<T> invalid(String field, String message) {
        return new Invalid<>(new ValidationError(field, message));
    }

    static <T> Validated<T> invalid(ValidationError error) {
        return new Invalid<>(error);
    }

    boolean isValid();

    /**
     * 실패 사유 (성공이면 empty)
     */
    Optional<ValidationError> error();

    /**
     * 성공 값 반환, 실패면 {@link ValidationException}
     */
    T orElseThrow();

    <R> Validated<R> map(Function<? super T, ? extends R> mapper);

    <R> Validated<R> flatMap(Function<? super T, Validated<R>> mapper);

    record Valid<T>(T value) implements Validated<T> {
        public Valid {
            Objects.requireNonNull(value, "Valid value cannot be null");
        }

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public Optional<ValidationError> error() {
            return Optional.empty();
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <R> Validated<R> map(Function<? super T, ? extends R> mapper) {
            return new Valid<>(mapper.apply(value));
        }

        @Override
        public <R> Validated<R> flatMap(Function<? super T, Validated<R>> mapper) {
            return mapper.apply(value);
        }
    }

    record Invalid<T>(ValidationError validationError) implements Validated<T> {
        public Invalid {
            Objects.requireNonNull(validationError, "Validation error cannot be null");
        }

        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Optional<ValidationError> error() {
            return Optional.of(validationError);
        }

        @Override
        public T orElseThrow() {
            throw new ValidationException(validationError);
        }

        @Override
        public <R> Validated<R> map(Function<? super T, ? extends R> mapper) {
            return new Invalid<>(validationError);
        }

        @Override
        public <R> Validated<R> flatMap(Function<? super T, Validated<R>> mapper) {
            return new Invalid<>(validationError);
        }
    }
}
