package com.ddm.metis.provider.ssm;

import com.ddm.metis.provider.SecretStore;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import com.ddm.metis.utils.EnvValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParametersRequest;
import software.amazon.awssdk.services.ssm.model.GetParametersResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 基于 AWS Systems Manager Parameter Store 的 {@link SecretStore} 实现，类型 {@code ssm}。
 *
 * <p><strong>支持的选项：</strong>
 * <ul>
 *   <li>{@code region}：AWS region，缺省走 SDK 默认链</li>
 *   <li>{@code prefix} / {@code project} / {@code app-env}：路径前缀，见 {@link ParameterPaths}</li>
 *   <li>{@code with-decryption}：是否解密 SecureString，默认 true</li>
 *   <li>{@code api-call-timeout}：ISO-8601 时长（如 {@code PT6S}）或秒数</li>
 * </ul>
 *
 * <p>批量读取使用 {@code GetParameters}，每次最多 10 个名称；
 * 扁平路径未找到的名称会再按旧版分层路径（{@link ParameterPaths#fallbackPathOf}）读取一次，
 * 两处都没有才视为 NotFound；SDK 异常视为 Unavailable。
 *
 * @author liyifei
 * @since 1.0
 */
public class SsmSecretStore implements SecretStore {

    private static final Logger log = LoggerFactory.getLogger(SsmSecretStore.class);

    public static final String TYPE = "ssm";
    public static final int MAX_BATCH = 10;

    public static final String OPT_REGION = "region";
    public static final String OPT_WITH_DECRYPTION = "with-decryption";
    public static final String OPT_API_CALL_TIMEOUT = "api-call-timeout";

    private SsmClient client;
    private ParameterPaths paths;
    private boolean withDecryption = true;

    public SsmSecretStore() {
    }

    SsmSecretStore(SsmClient client, ParameterPaths paths, boolean withDecryption) {
        this.client = Objects.requireNonNull(client, "client");
        this.paths = Objects.requireNonNull(paths, "paths");
        this.withDecryption = withDecryption;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void init(Map<String, String> options) {
        Map<String, String> opts = options == null ? Map.of() : options;
        this.paths = ParameterPaths.from(opts, System.getenv());
        String decrypt = EnvValues.trimToNull(opts.get(OPT_WITH_DECRYPTION));
        this.withDecryption = decrypt == null || Boolean.parseBoolean(decrypt);
        String region = EnvValues.trimToNull(opts.get(OPT_REGION));
        this.client = SsmClientFactory.ssm(region == null ? null : Region.of(region),
                parseTimeout(opts.get(OPT_API_CALL_TIMEOUT)));
        log.info("SSM parameter store initialized (prefix={}, region={}, decrypt={})",
                paths.prefix(), region == null ? "default" : region, withDecryption);
    }

    @Override
    public Result<String> get(String name) {
        String path = paths.pathOf(name);
        String fallback = paths.fallbackPathOf(name);
        try {
            String value = fetchOne(path);
            if (value == null) {
                value = fetchOne(fallback);
            }
            if (value == null) {
                return Result.failure(ConfigError.notFound(name, path + ", " + fallback));
            }
            return Result.success(value);
        } catch (SdkException e) {
            log.debug("Failed to fetch parameter {}: {}", name, e.getMessage());
            return Result.failure(ConfigError.unavailable(name, e.getMessage(), e));
        }
    }

    /**
     * @return 参数值，不存在时返回 null
     */
    private String fetchOne(String path) {
        try {
            Parameter p = client.getParameter(GetParameterRequest.builder()
                    .name(path)
                    .withDecryption(withDecryption)
                    .build()).parameter();
            log.debug("Fetched parameter {}", path);
            return p.value();
        } catch (ParameterNotFoundException e) {
            return null;
        }
    }

    @Override
    public Map<String, Result<String>> getMany(List<String> names) {
        Map<String, Result<String>> out = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i += MAX_BATCH) {
            out.putAll(fetchBatch(names.subList(i, Math.min(i + MAX_BATCH, names.size()))));
        }
        return out;
    }

    /**
     * 先按扁平路径批量读取，未找到的名称再按分层路径补读一次。
     */
    private Map<String, Result<String>> fetchBatch(List<String> names) {
        Map<String, Result<String>> out = new LinkedHashMap<>();
        try {
            Map<String, String> found = fetchPaths(names, paths::pathOf);
            List<String> missing = new ArrayList<>();
            for (String name : names) {
                if (!found.containsKey(name)) {
                    missing.add(name);
                }
            }
            if (!missing.isEmpty()) {
                found.putAll(fetchPaths(missing, paths::fallbackPathOf));
            }
            for (String name : names) {
                String value = found.get(name);
                out.put(name, value != null
                        ? Result.success(value)
                        : Result.failure(ConfigError.notFound(name,
                        paths.pathOf(name) + ", " + paths.fallbackPathOf(name))));
            }
        } catch (SdkException e) {
            log.debug("Batch fetch of {} parameter(s) failed: {}", names.size(), e.getMessage());
            for (String name : names) {
                out.put(name, Result.failure(ConfigError.unavailable(name, e.getMessage(), e)));
            }
        }
        return out;
    }

    /**
     * @return 逻辑名到值，只包含找到的参数
     */
    private Map<String, String> fetchPaths(List<String> names, Function<String, String> pathOf) {
        Map<String, String> byPath = new HashMap<>();
        for (String name : names) {
            byPath.put(pathOf.apply(name), name);
        }
        GetParametersResponse resp = client.getParameters(GetParametersRequest.builder()
                .names(byPath.keySet())
                .withDecryption(withDecryption)
                .build());
        Map<String, String> found = new HashMap<>();
        for (Parameter p : resp.parameters()) {
            String name = byPath.get(p.name());
            if (name != null) {
                found.put(name, p.value());
            }
        }
        if (resp.hasInvalidParameters() && !resp.invalidParameters().isEmpty()) {
            log.debug("Parameters not found: {}", resp.invalidParameters());
        }
        return found;
    }

    @Override
    public int batchSize() {
        return MAX_BATCH;
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }

    static Duration parseTimeout(String raw) {
        String v = EnvValues.trimToNull(raw);
        if (v == null) {
            return SsmClientFactory.DEFAULT_API_CALL_TIMEOUT;
        }
        Integer seconds = EnvValues.toInt(v);
        return seconds != null ? Duration.ofSeconds(seconds) : Duration.parse(v);
    }
}
