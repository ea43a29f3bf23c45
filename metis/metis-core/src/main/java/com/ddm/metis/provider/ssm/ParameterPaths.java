package com.ddm.metis.provider.ssm;

import com.ddm.metis.utils.EnvValues;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 逻辑参数名到 Parameter Store 路径的映射：{@code prefix + UPPER_SNAKE(name)}。
 * <p>
 * 前缀优先级：选项 {@code prefix} &gt; 环境变量 {@code PARAMETER_STORE_PREFIX} &gt;
 * {@code /<project>/<app-env>/}，其中预览环境 {@code pr-N} 映射为 {@code development}。
 * <p>
 * 旧版分层路径作为回退：{@code prefix + critical/<name>}（关键密钥）或 {@code prefix + standard/<name>}。
 *
 * @author liyifei
 */
public final class ParameterPaths {

    public static final String OPT_PREFIX = "prefix";
    public static final String OPT_PROJECT = "project";
    public static final String OPT_APP_ENV = "app-env";
    public static final String ENV_PREFIX = "PARAMETER_STORE_PREFIX";
    public static final String ENV_APP_ENV = "APP_ENV";
    static final String DEFAULT_APP_ENV = "development";

    /**
     * 旧版分层结构中存放在 {@code critical/} 下的参数。
     */
    static final Set<String> CRITICAL = Set.of(
            "api-key",
            "cookie-encryption-key",
            "cognito-user-pool-secret-key",
            "cognito-access-key",
            "cognito-secret-key",
            "openai-api-key",
            "neon-database-url",
            "upstash-redis-url");

    private final String prefix;

    ParameterPaths(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        String p = prefix.startsWith("/") ? prefix : "/" + prefix;
        this.prefix = p.endsWith("/") ? p : p + "/";
    }

    /**
     * @param options 提供者选项
     * @param env     进程环境变量
     * @throws IllegalArgumentException 既没有前缀也没有 project
     */
    static ParameterPaths from(Map<String, String> options, Map<String, String> env) {
        String prefix = EnvValues.firstNonBlank(options.get(OPT_PREFIX), env.get(ENV_PREFIX));
        if (prefix != null) {
            return new ParameterPaths(prefix.trim());
        }
        String project = EnvValues.trimToNull(options.get(OPT_PROJECT));
        if (project == null) {
            throw new IllegalArgumentException("ssm store requires option '" + OPT_PREFIX + "' or '"
                    + OPT_PROJECT + "' (or env " + ENV_PREFIX + ")");
        }
        String appEnv = EnvValues.firstNonBlank(options.get(OPT_APP_ENV), env.get(ENV_APP_ENV), DEFAULT_APP_ENV).trim();
        if (appEnv.startsWith("pr-")) {
            appEnv = DEFAULT_APP_ENV;
        }
        return new ParameterPaths("/" + project + "/" + appEnv + "/");
    }

    public String prefix() {
        return prefix;
    }

    public String pathOf(String name) {
        return prefix + EnvValues.toUpperSnake(name);
    }

    public String fallbackPathOf(String name) {
        return prefix + (CRITICAL.contains(name) ? "critical/" : "standard/") + name;
    }
}
