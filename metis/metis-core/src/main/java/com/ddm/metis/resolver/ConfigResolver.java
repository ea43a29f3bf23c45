package com.ddm.metis.resolver;

import com.ddm.metis.cache.CacheStats;
import com.ddm.metis.cache.SecretCache;
import com.ddm.metis.classify.Diagnosis;
import com.ddm.metis.classify.EnvironmentClassifier;
import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.defined.ResolutionStage;
import com.ddm.metis.loader.BuildTimeLoader;
import com.ddm.metis.loader.LocalFileLoader;
import com.ddm.metis.loader.ManagedRuntimeLoader;
import com.ddm.metis.loader.RemoteFailurePolicy;
import com.ddm.metis.loader.SourceLoader;
import com.ddm.metis.mapper.AnnotatedAppConfig;
import com.ddm.metis.mapper.AppConfig;
import com.ddm.metis.mapper.ConfigMapper;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import com.ddm.metis.schema.SchemaValidator;
import com.ddm.metis.schema.ValidatedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 配置解析门面，驱动完整流程：判定上下文 → 选择加载器 → 加载 → 校验 → 映射 → 标注。
 *
 * <p><strong>进程级缓存：</strong>
 * 第一次成功的解析结果会被持有，之后的 {@link #resolve} 直接返回，不再重跑流程；
 * 只有 {@link #invalidateCache()} / {@link #invalidateCache(String)} / {@link #reset()} 之后才会重新解析。
 *
 * <p><strong>错误处理：</strong>
 * 任一阶段失败即短路，返回 {@link ConfigError.StageFailure}（标明阶段并包装具体错误），
 * 不抛出异常。是否致命由调用方决定；Spring 启动阶段会将失败转为 {@link ConfigResolutionException}。
 *
 * <p>非单例：由调用方（或 Spring 自动配置）构造一次并注入使用。
 *
 * @author liyifei
 * @since 1.0
 */
public final class ConfigResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    private final ResolverSettings settings;
    private final SecretCache cache;
    private final ResolutionListener listener;
    private final EnvironmentClassifier classifier;
    private final SchemaValidator validator;
    private final ConfigMapper mapper = new ConfigMapper();

    private final AtomicReference<Resolution> retained = new AtomicReference<>();
    private final AtomicReference<ResolutionStage> stage = new AtomicReference<>(ResolutionStage.IDLE);

    public ConfigResolver(ResolverSettings settings, SecretCache cache) {
        this(settings, cache, new LoggingResolutionListener());
    }

    public ConfigResolver(ResolverSettings settings, SecretCache cache, ResolutionListener listener) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.listener = listener == null ? ResolutionListener.NOOP : listener;
        this.classifier = new EnvironmentClassifier(settings.env());
        this.validator = new SchemaValidator(settings.schema());
    }

    public CompletableFuture<Result<AppConfig>> resolve() {
        return resolve(ResolveOptions.defaults());
    }

    /**
     * 异步解析，适用于所有部署上下文。
     */
    public CompletableFuture<Result<AppConfig>> resolve(ResolveOptions options) {
        Objects.requireNonNull(options, "options");
        Resolution cached = retained.get();
        if (cached != null) {
            log.debug("Returning retained configuration");
            return CompletableFuture.completedFuture(Result.success(cached.config()));
        }
        StageTracker tracker = tracker(options);
        DeploymentContext context = classify(options, tracker);
        List<ConfigError> warnings = new CopyOnWriteArrayList<>();
        SourceLoader loader = loaderFor(context, options, warnings::add);
        return run(loader, options, tracker, warnings);
    }

    public Result<AppConfig> resolveSync() {
        return resolveSync(ResolveOptions.defaults());
    }

    /**
     * 同步解析。选中的加载器需要远端访问时立即返回 {@link ConfigError.UsageError}。
     */
    public Result<AppConfig> resolveSync(ResolveOptions options) {
        Objects.requireNonNull(options, "options");
        Resolution cached = retained.get();
        if (cached != null) {
            return Result.success(cached.config());
        }
        StageTracker tracker = tracker(options);
        DeploymentContext context = classify(options, tracker);
        List<ConfigError> warnings = new CopyOnWriteArrayList<>();
        SourceLoader loader = loaderFor(context, options, warnings::add);
        if (loader.isAsync()) {
            tracker.begin(ResolutionStage.LOADING);
            ConfigError error = tracker.fail(ConfigError.usage("Synchronous resolution is not available in the "
                    + context + " context because it requires remote lookups; use resolve() instead"));
            log.error("{}", error.message());
            return Result.failure(error);
        }
        return run(loader, options, tracker, warnings).join();
    }

    private StageTracker tracker(ResolveOptions options) {
        return new StageTracker(options.enableLogging() ? listener : ResolutionListener.NOOP, settings.clock(),
                this::publish);
    }

    /**
     * 已持有成功结果时，只有 DONE 能覆盖对外可见的阶段。
     */
    private void publish(ResolutionStage next) {
        if (next != ResolutionStage.DONE && retained.get() != null) {
            return;
        }
        stage.set(next);
    }

    private DeploymentContext classify(ResolveOptions options, StageTracker tracker) {
        tracker.begin(ResolutionStage.CLASSIFYING);
        DeploymentContext context;
        if (options.forceContext() != null) {
            context = options.forceContext();
            log.info("Deployment context forced to {}", context);
        } else {
            Diagnosis diagnosis = classifier.diagnose();
            context = diagnosis.context();
            log.info("Deployment context classified as {}", context);
        }
        tracker.context(context);
        tracker.complete(null);
        return context;
    }

    private SourceLoader loaderFor(DeploymentContext context, ResolveOptions options,
                                   Consumer<ConfigError.RemoteFetchWarning> warnings) {
        switch (context) {
            case BUILD_TIME:
                return new BuildTimeLoader(settings.env(), settings.schema());
            case MANAGED_RUNTIME:
                RemoteFailurePolicy policy = options.remoteFailurePolicy() != null
                        ? options.remoteFailurePolicy() : settings.policy();
                return new ManagedRuntimeLoader(settings.env(), settings.schema(), cache,
                        settings.registry(), policy, warnings);
            case LOCAL:
            default:
                return new LocalFileLoader(settings.env(), settings.schema(), settings.envDir(),
                        settings.effectiveLocalFiles());
        }
    }

    private CompletableFuture<Result<AppConfig>> run(SourceLoader loader, ResolveOptions options,
                                                     StageTracker tracker, List<ConfigError> warnings) {
        tracker.begin(ResolutionStage.LOADING);
        CompletableFuture<Result<RawEnvironment>> loading;
        try {
            loading = loader.isAsync() ? loader.loadAsync() : CompletableFuture.completedFuture(loader.load());
        } catch (RuntimeException e) {
            loading = CompletableFuture.failedFuture(e);
        }
        return loading.handle((loaded, ex) -> {
            if (ex != null) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                log.error("Loader for {} failed unexpectedly", loader.context(), cause);
                return Result.<AppConfig>failure(tracker.fail(
                        ConfigError.sourceLoad(loader.context().id(), String.valueOf(cause.getMessage()), cause)));
            }
            try {
                return complete(loaded, options, tracker, warnings);
            } catch (RuntimeException e) {
                log.error("Resolution for {} failed unexpectedly at stage {}", loader.context(), tracker.stage(), e);
                return Result.<AppConfig>failure(tracker.fail(
                        ConfigError.sourceLoad(loader.context().id(), String.valueOf(e.getMessage()), e)));
            }
        });
    }

    private Result<AppConfig> complete(Result<RawEnvironment> loaded, ResolveOptions options,
                                       StageTracker tracker, List<ConfigError> warnings) {
        if (loaded instanceof Result.Failure<RawEnvironment> f) {
            return Result.failure(tracker.fail(f.error()));
        }
        RawEnvironment raw = loaded.toOptional().orElseThrow();
        tracker.complete(raw.countBySource());

        tracker.begin(ResolutionStage.VALIDATING);
        Result<ValidatedConfig> validated = validator.validate(raw, options.enableValidation());
        if (validated instanceof Result.Failure<ValidatedConfig> f) {
            return Result.failure(tracker.fail(f.error()));
        }
        ValidatedConfig config = validated.toOptional().orElseThrow();
        tracker.complete(null);

        tracker.begin(ResolutionStage.MAPPING);
        AppConfig app = mapper.map(config);
        AnnotatedAppConfig annotated = mapper.annotate(app, config.provenance(), tracker.context(),
                settings.clock().instant());
        tracker.complete(null);

        Resolution resolution = new Resolution(app, annotated, warnings);
        if (!retained.compareAndSet(null, resolution)) {
            // 并发解析时保留先完成的结果
            resolution = retained.get() != null ? retained.get() : resolution;
        }
        tracker.done(raw.countBySource());
        log.info("Configuration resolved for {} context ({} fields, {} remote warning(s))",
                tracker.context(), annotated.statistics().totalFields(), warnings.size());
        return Result.success(resolution.config());
    }

    /**
     * 清空远端密钥缓存与已持有的配置。
     */
    public void invalidateCache() {
        cache.invalidateAll();
        retained.set(null);
    }

    /**
     * 移除单个密钥与已持有的配置，下次解析会重新读取。
     */
    public void invalidateCache(String key) {
        cache.invalidate(key);
        retained.set(null);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * 恢复到刚构造时的状态。
     */
    public void reset() {
        invalidateCache();
        stage.set(ResolutionStage.IDLE);
        log.info("Config resolver reset");
    }

    public Optional<AppConfig> current() {
        return Optional.ofNullable(retained.get()).map(Resolution::config);
    }

    public Optional<AnnotatedAppConfig> annotated() {
        return Optional.ofNullable(retained.get()).map(Resolution::annotated);
    }

    public List<ConfigError> warnings() {
        Resolution r = retained.get();
        return r == null ? List.of() : r.warnings();
    }

    public ResolutionStage stage() {
        return stage.get();
    }

    public Diagnosis diagnose() {
        return classifier.diagnose();
    }

    public ConfigMapper mapper() {
        return mapper;
    }

    @Override
    public void close() {
        cache.close();
    }
}
