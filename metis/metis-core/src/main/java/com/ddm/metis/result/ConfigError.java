package com.ddm.metis.result;

import com.ddm.metis.defined.ResolutionStage;
import com.ddm.metis.schema.Violation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 配置解析的错误分类。
 * <ul>
 *   <li>{@link ValidationError}：一个或多个字段未通过 schema 校验，总是致命</li>
 *   <li>{@link SourceLoadError}：本地文件格式错误，或权威远端存储不可用，致命</li>
 *   <li>{@link RemoteFetchWarning}：非权威远端读取失败并使用了回退值，仅记录</li>
 *   <li>{@link UsageError}：调用方在需要网络的上下文中请求了同步路径</li>
 *   <li>{@link NotFound} / {@link Unavailable}：远端存储返回的单键错误</li>
 *   <li>{@link PartialFailure}：批量读取中失败的子集</li>
 *   <li>{@link StageFailure}：由解析门面包装，标明失败阶段</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public sealed interface ConfigError {

    String message();

    default Optional<Throwable> cause() {
        return Optional.empty();
    }

    record ValidationError(List<Violation> violations) implements ConfigError {
        public ValidationError {
            violations = List.copyOf(violations);
        }

        @Override
        public String message() {
            return "Configuration validation failed: " + violations.stream()
                    .map(Violation::describe)
                    .collect(Collectors.joining(", "));
        }
    }

    record SourceLoadError(String source, String reason, List<String> unresolvedKeys, Throwable error)
            implements ConfigError {
        public SourceLoadError {
            Objects.requireNonNull(source, "source");
            unresolvedKeys = List.copyOf(unresolvedKeys);
        }

        @Override
        public String message() {
            String base = "Failed to load configuration from " + source + ": " + reason;
            return unresolvedKeys.isEmpty() ? base : base + " (unresolved: " + String.join(", ", unresolvedKeys) + ")";
        }

        @Override
        public Optional<Throwable> cause() {
            return Optional.ofNullable(error);
        }
    }

    record RemoteFetchWarning(String key, String outcome, ConfigError underlying) implements ConfigError {
        @Override
        public String message() {
            return "Remote lookup for " + key + " failed, " + outcome + ": " + underlying.message();
        }
    }

    record UsageError(String reason) implements ConfigError {
        @Override
        public String message() {
            return reason;
        }
    }

    record NotFound(String key, String location) implements ConfigError {
        @Override
        public String message() {
            return "Parameter " + key + " not found at " + location;
        }
    }

    record Unavailable(String key, String reason, Throwable error) implements ConfigError {
        @Override
        public String message() {
            return "Remote store unavailable for " + key + ": " + reason;
        }

        @Override
        public Optional<Throwable> cause() {
            return Optional.ofNullable(error);
        }
    }

    record PartialFailure(Map<String, ConfigError> failures) implements ConfigError {
        public PartialFailure {
            failures = Map.copyOf(failures);
        }

        @Override
        public String message() {
            return "Failed to retrieve " + failures.size() + " parameter(s): " + failures.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .map(e -> e.getKey() + " (" + e.getValue().message() + ")")
                    .collect(Collectors.joining("; "));
        }
    }

    record StageFailure(ResolutionStage stage, ConfigError underlying) implements ConfigError {
        @Override
        public String message() {
            return "Configuration resolution failed at stage '" + stage.label() + "': " + underlying.message();
        }

        @Override
        public Optional<Throwable> cause() {
            return underlying.cause();
        }
    }

    static SourceLoadError sourceLoad(String source, String reason) {
        return new SourceLoadError(source, reason, List.of(), null);
    }

    static SourceLoadError sourceLoad(String source, String reason, Throwable error) {
        return new SourceLoadError(source, reason, List.of(), error);
    }

    static SourceLoadError unresolved(String source, String reason, List<String> keys) {
        return new SourceLoadError(source, reason, keys, null);
    }

    static UsageError usage(String reason) {
        return new UsageError(reason);
    }

    static NotFound notFound(String key, String location) {
        return new NotFound(key, location);
    }

    static Unavailable unavailable(String key, String reason, Throwable error) {
        return new Unavailable(key, reason, error);
    }
}
