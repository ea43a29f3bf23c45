package com.ddm.metis.resolver;

import com.ddm.metis.loader.LocalFileLoader;
import com.ddm.metis.loader.RemoteFailurePolicy;
import com.ddm.metis.loader.SecretRegistry;
import com.ddm.metis.schema.AppSchema;
import com.ddm.metis.schema.ConfigSchema;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 解析器的构造期设置，进程内固定不变。
 *
 * @param env        进程环境变量
 * @param envDir     本地覆盖文件所在目录
 * @param localFiles 覆盖文件名（优先级升序），null 表示按 NODE_ENV 推导
 * @param schema     字段声明
 * @param registry   托管运行时的远端键清单
 * @param policy     默认远端失败策略
 * @param clock      时间源
 * @author liyifei
 */
public record ResolverSettings(Map<String, String> env,
                               Path envDir,
                               List<String> localFiles,
                               ConfigSchema schema,
                               SecretRegistry registry,
                               RemoteFailurePolicy policy,
                               Clock clock) {

    public ResolverSettings {
        env = Map.copyOf(Objects.requireNonNull(env, "env"));
        Objects.requireNonNull(envDir, "envDir");
        localFiles = localFiles == null ? null : List.copyOf(localFiles);
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(clock, "clock");
    }

    public List<String> effectiveLocalFiles() {
        return localFiles != null ? localFiles : LocalFileLoader.defaultFiles(env);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Map<String, String> env = System.getenv();
        private Path envDir = Path.of("").toAbsolutePath();
        private List<String> localFiles;
        private ConfigSchema schema = AppSchema.SCHEMA;
        private SecretRegistry registry = SecretRegistry.defaults();
        private RemoteFailurePolicy policy = RemoteFailurePolicy.TOLERANT;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder envDir(Path envDir) {
            this.envDir = envDir;
            return this;
        }

        public Builder localFiles(List<String> localFiles) {
            this.localFiles = localFiles;
            return this;
        }

        public Builder schema(ConfigSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder registry(SecretRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder policy(RemoteFailurePolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ResolverSettings build() {
            return new ResolverSettings(env, envDir, localFiles, schema, registry, policy, clock);
        }
    }
}
