package com.ddm.metis.resolver;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.defined.ResolutionStage;
import com.ddm.metis.result.ConfigError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 单次解析的阶段计时与事件发送。
 * <p>
 * 当前阶段只属于本次解析，经 {@code publish} 同步给解析器用于 {@code stage()} 查询。
 *
 * @author liyifei
 */
final class StageTracker {

    private static final Logger log = LoggerFactory.getLogger(StageTracker.class);

    private final ResolutionListener listener;
    private final Clock clock;
    private final Consumer<ResolutionStage> publish;
    private volatile ResolutionStage current = ResolutionStage.IDLE;
    private volatile DeploymentContext context;
    private volatile Instant stageStart;

    StageTracker(ResolutionListener listener, Clock clock, Consumer<ResolutionStage> publish) {
        this.listener = listener;
        this.clock = clock;
        this.publish = publish;
    }

    void begin(ResolutionStage stage) {
        move(stage);
        stageStart = clock.instant();
    }

    ResolutionStage stage() {
        return current;
    }

    void context(DeploymentContext context) {
        this.context = context;
    }

    DeploymentContext context() {
        return context;
    }

    void complete(Map<ConfigSource, Integer> counts) {
        emit(current, true, null, counts);
    }

    void done(Map<ConfigSource, Integer> counts) {
        move(ResolutionStage.DONE);
        emit(ResolutionStage.DONE, true, null, counts);
    }

    /**
     * @return 包装了失败阶段的错误
     */
    ConfigError fail(ConfigError error) {
        ResolutionStage stage = current;
        ConfigError wrapped = error instanceof ConfigError.StageFailure ? error : new ConfigError.StageFailure(stage, error);
        emit(stage, false, wrapped.message(), null);
        move(ResolutionStage.FAILED);
        return wrapped;
    }

    private void move(ResolutionStage stage) {
        current = stage;
        publish.accept(stage);
    }

    private void emit(ResolutionStage stage, boolean success, String error, Map<ConfigSource, Integer> counts) {
        Instant now = clock.instant();
        long duration = stageStart == null ? 0 : Math.max(0, Duration.between(stageStart, now).toMillis());
        try {
            listener.onStage(new StageEvent(stage, context, now, duration, success, error, counts));
        } catch (RuntimeException e) {
            log.warn("Resolution listener failed on stage {}", stage, e);
        }
    }
}
