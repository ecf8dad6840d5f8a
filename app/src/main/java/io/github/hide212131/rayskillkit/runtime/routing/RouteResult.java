package io.github.hide212131.rayskillkit.runtime.routing;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of routing a payload to a skill.
 */
public sealed interface RouteResult<T> permits RouteResult.Success, RouteResult.Failure {

    static <T> RouteResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> RouteResult<T> failure(SkillRouteException error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    Optional<T> toOptional();

    Optional<SkillRouteException> error();

    /**
     * @throws SkillRouteException when this is a failure
     */
    T orElseThrow();

    <U> RouteResult<U> map(Function<? super T, ? extends U> mapper);

    record Success<T>(T value) implements RouteResult<T> {

        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.of(value);
        }

        @Override
        public Optional<SkillRouteException> error() {
            return Optional.empty();
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <U> RouteResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    record Failure<T>(SkillRouteException exception) implements RouteResult<T> {

        public Failure {
            Objects.requireNonNull(exception, "exception");
        }

        public RouteErrorCategory category() {
            return exception.category();
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public Optional<SkillRouteException> error() {
            return Optional.of(exception);
        }

        @Override
        public T orElseThrow() {
            throw exception;
        }

        @Override
        public <U> RouteResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(exception);
        }
    }
}
