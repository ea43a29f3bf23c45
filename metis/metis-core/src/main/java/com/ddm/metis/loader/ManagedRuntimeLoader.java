package com.ddm.metis.loader;

import com.ddm.metis.cache.SecretBatch;
import com.ddm.metis.cache.SecretCache;
import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import com.ddm.metis.schema.ConfigSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 托管运行时加载器：进程环境变量为底，再从远端密钥缓存读取 {@link SecretRegistry} 中的键。
 *
 * <p>每个键的取值顺序：缓存命中 &gt; 远端读取 &gt; 静态回退值 &gt; 保留进程值（若有）。
 * 远端失败的处理由 {@link RemoteFailurePolicy} 决定：
 * <ul>
 *   <li>{@code TOLERANT}：记录 {@link ConfigError.RemoteFetchWarning} 并继续</li>
 *   <li>{@code AUTHORITATIVE}：必填键远端读取失败即整体失败，错误中列出全部未解析的键</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public final class ManagedRuntimeLoader implements SourceLoader {

    private static final Logger log = LoggerFactory.getLogger(ManagedRuntimeLoader.class);

    static final String SOURCE = "remote-store";

    private final Map<String, String> env;
    private final ConfigSchema schema;
    private final SecretCache cache;
    private final SecretRegistry registry;
    private final RemoteFailurePolicy policy;
    private final Consumer<ConfigError.RemoteFetchWarning> warnings;

    public ManagedRuntimeLoader(Map<String, String> env,
                                ConfigSchema schema,
                                SecretCache cache,
                                SecretRegistry registry,
                                RemoteFailurePolicy policy,
                                Consumer<ConfigError.RemoteFetchWarning> warnings) {
        this.env = Objects.requireNonNull(env, "env");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.warnings = warnings == null ? w -> { } : warnings;
    }

    @Override
    public DeploymentContext context() {
        return DeploymentContext.MANAGED_RUNTIME;
    }

    @Override
    public boolean isAsync() {
        return true;
    }

    @Override
    public Result<RawEnvironment> load() {
        return Result.failure(ConfigError.usage(
                "Managed runtime configuration requires remote lookups; use the asynchronous resolve path"));
    }

    @Override
    public CompletableFuture<Result<RawEnvironment>> loadAsync() {
        return cache.getMany(registry.parameterNames()).thenApply(this::merge);
    }

    private Result<RawEnvironment> merge(SecretBatch batch) {
        RawEnvironment.Builder builder = ProcessValues.base(env, schema);
        List<String> unresolved = new ArrayList<>();
        int remote = 0;

        for (SecretMapping m : registry.mappings()) {
            String value = batch.values().get(m.parameterName());
            if (value != null) {
                builder.put(m.envKey(), value, ConfigSource.REMOTE_STORE);
                remote++;
                continue;
            }
            ConfigError cause = batch.failures().getOrDefault(m.parameterName(),
                    ConfigError.unavailable(m.parameterName(), "no result", null));

            if (policy == RemoteFailurePolicy.AUTHORITATIVE && m.required()) {
                unresolved.add(m.envKey());
                log.error("Required secret {} could not be resolved from the remote store: {}",
                        m.envKey(), cause.message());
                continue;
            }

            String outcome;
            if (m.fallback() != null) {
                builder.put(m.envKey(), m.fallback(), ConfigSource.FALLBACK_DEFAULT);
                outcome = "using static fallback";
            } else if (builder.contains(m.envKey())) {
                outcome = "keeping environment value";
            } else {
                outcome = "left unset";
            }
            ConfigError.RemoteFetchWarning warning = new ConfigError.RemoteFetchWarning(m.envKey(), outcome, cause);
            log.warn("{}", warning.message());
            warnings.accept(warning);
        }

        if (!unresolved.isEmpty()) {
            return Result.failure(ConfigError.unresolved(SOURCE,
                    "authoritative remote store could not resolve required keys", unresolved));
        }
        RawEnvironment raw = builder.build();
        log.info("Managed runtime configuration loaded ({} keys, {} from remote store)", raw.size(), remote);
        return Result.success(raw);
    }
}
