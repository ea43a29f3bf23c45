package com.ddm.metis.loader;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import com.ddm.metis.schema.ConfigSchema;
import com.ddm.metis.schema.FieldSpec;
import com.ddm.metis.schema.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 构建期加载器：不访问网络，不读文件。
 *
 * <p>必填字段（密钥、连接串等）一律填入 {@code build-time-placeholder-<key>}，
 * 非必填字段取进程环境变量，缺失时使用 schema 默认值。
 * 只有显式设置的值自相矛盾时（端口越界、未知的 NODE_ENV 等）才会失败。
 *
 * @author liyifei
 */
public final class BuildTimeLoader implements SourceLoader {

    private static final Logger log = LoggerFactory.getLogger(BuildTimeLoader.class);

    public static final String PLACEHOLDER_PREFIX = "build-time-placeholder-";

    private final Map<String, String> env;
    private final ConfigSchema schema;

    public BuildTimeLoader(Map<String, String> env, ConfigSchema schema) {
        this.env = Objects.requireNonNull(env, "env");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public DeploymentContext context() {
        return DeploymentContext.BUILD_TIME;
    }

    @Override
    public Result<RawEnvironment> load() {
        RawEnvironment.Builder builder = RawEnvironment.builder();
        int placeholders = 0;
        for (FieldSpec spec : schema.fields()) {
            String explicit = env.get(spec.key());
            if (spec.required()) {
                builder.put(spec.key(), placeholder(spec.key()), ConfigSource.FALLBACK_DEFAULT);
                placeholders++;
            } else if (explicit != null && !explicit.isBlank()) {
                builder.put(spec.key(), explicit, ConfigSource.ENVIRONMENT);
            } else if (spec.defaultValue() != null) {
                builder.put(spec.key(), spec.defaultValue(), ConfigSource.FALLBACK_DEFAULT);
            }
        }
        RawEnvironment raw = builder.build();

        // 占位符总能通过校验，失败只可能来自显式设置的值
        Result<RawEnvironment> checked = new SchemaValidator(schema).validate(raw)
                .map(ignored -> raw)
                .mapError(e -> ConfigError.sourceLoad("build-time", e.message()));
        if (checked.isSuccess()) {
            log.info("Build-time configuration loaded ({} keys, {} placeholders)", raw.size(), placeholders);
        }
        return checked;
    }

    public static String placeholder(String key) {
        return PLACEHOLDER_PREFIX + key.toLowerCase(Locale.ROOT);
    }
}
