package com.ddm.metis.loader;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.result.Result;
import com.ddm.metis.schema.ConfigSchema;
import com.ddm.metis.schema.FieldSpec;
import com.ddm.metis.utils.EnvValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 本地开发加载器：进程环境变量为底，按优先级从低到高叠加覆盖文件。
 *
 * <p>默认文件顺序：{@code .env}、{@code .env.local}（NODE_ENV=test 时跳过）、
 * {@code .env.<NODE_ENV>}（默认 development）。后加载的文件覆盖先加载的。
 * 缺失的文件跳过；格式错误的文件导致加载失败。
 *
 * @author liyifei
 */
public final class LocalFileLoader implements SourceLoader {

    private static final Logger log = LoggerFactory.getLogger(LocalFileLoader.class);

    private final Map<String, String> env;
    private final ConfigSchema schema;
    private final Path baseDir;
    private final List<String> files;

    public LocalFileLoader(Map<String, String> env, ConfigSchema schema, Path baseDir) {
        this(env, schema, baseDir, defaultFiles(env));
    }

    /**
     * @param files 覆盖文件名，按优先级升序
     */
    public LocalFileLoader(Map<String, String> env, ConfigSchema schema, Path baseDir, List<String> files) {
        this.env = Objects.requireNonNull(env, "env");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.files = List.copyOf(files);
    }

    public static List<String> defaultFiles(Map<String, String> env) {
        String nodeEnv = EnvValues.firstNonBlank(env.get("NODE_ENV"), "development").trim();
        List<String> files = new ArrayList<>();
        files.add(".env");
        if (!"test".equals(nodeEnv)) {
            files.add(".env.local");
        }
        files.add(".env." + nodeEnv);
        return files;
    }

    @Override
    public DeploymentContext context() {
        return DeploymentContext.LOCAL;
    }

    @Override
    public Result<RawEnvironment> load() {
        RawEnvironment.Builder builder = ProcessValues.base(env, schema);
        Set<String> keys = Set.copyOf(schema.fields().stream().map(FieldSpec::key).toList());
        int loaded = 0;
        for (String name : files) {
            Path file = baseDir.resolve(name);
            if (!Files.isRegularFile(file)) {
                log.debug("Override file {} not found, skipping", file);
                continue;
            }
            Result<Map<String, String>> parsed = EnvFileParser.parse(file);
            if (parsed instanceof Result.Failure<Map<String, String>> f) {
                log.error("Failed to parse override file {}: {}", file, f.error().message());
                return Result.failure(f.error());
            }
            Map<String, String> values = parsed.toOptional().orElse(Map.of());
            values.forEach((k, v) -> {
                if (keys.contains(k)) {
                    builder.put(k, v, ConfigSource.LOCAL_FILE);
                }
            });
            loaded++;
            log.debug("Applied override file {} ({} entries)", file, values.size());
        }
        RawEnvironment raw = builder.build();
        log.info("Local configuration loaded from {} file(s) in {} ({} keys)", loaded, baseDir, raw.size());
        return Result.success(raw);
    }
}
