package com.ddm.metis.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 显式的成功/失败结果类型。
 * <p>
 * 解析引擎中所有可能失败的操作都返回 {@code Result}，而不是抛出异常；
 * 由调用方（最终是 {@code ConfigResolver}）决定某个错误是否致命。
 *
 * <ul>
 *   <li>{@link Success}：携带成功值</li>
 *   <li>{@link Failure}：携带 {@link ConfigError}</li>
 * </ul>
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * Result<String> r = cache.get("api-key");
 * if (r instanceof Result.Success<String> s) {
 *     use(s.value());
 * } else if (r instanceof Result.Failure<String> f) {
 *     log.warn("lookup failed: {}", f.error().message());
 * }
 * }</pre>
 *
 * @param <T> 成功值类型
 * @author liyifei
 * @since 1.0
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * 成功结果。
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * 失败结果。
     */
    record Failure<T>(ConfigError error) implements Result<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(ConfigError error) {
        return new Failure<>(error);
    }

    default <U> Result<U> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Success<T> s) {
            return new Success<>(fn.apply(s.value()));
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
        if (this instanceof Success<T> s) {
            return fn.apply(s.value());
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default Result<T> mapError(UnaryOperator<ConfigError> fn) {
        if (this instanceof Failure<T> f) {
            return new Failure<>(fn.apply(f.error()));
        }
        return this;
    }

    /**
     * 成功时返回值，失败时返回空。
     */
    default Optional<T> toOptional() {
        return this instanceof Success<T> s ? Optional.ofNullable(s.value()) : Optional.empty();
    }

    default Optional<ConfigError> errorOptional() {
        return this instanceof Failure<T> f ? Optional.of(f.error()) : Optional.empty();
    }

    /**
     * 成功时返回值，失败时通过 {@code exceptionFactory} 抛出异常。
     * 仅供边界层（如 Spring 启动阶段）使用。
     */
    default <X extends RuntimeException> T getOrThrow(Function<ConfigError, X> exceptionFactory) {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        throw exceptionFactory.apply(((Failure<T>) this).error());
    }
}
