package com.ddm.metis.mapper;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.schema.ValidatedConfig;
import com.ddm.metis.utils.EnvValues;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.ddm.metis.schema.AppSchema.*;

/**
 * {@link ValidatedConfig} 到 {@link AppConfig} 的映射，是唯一出现字段名对应关系的地方。
 *
 * @author liyifei
 */
public final class ConfigMapper {

    private static final Logger log = LoggerFactory.getLogger(ConfigMapper.class);

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final Map<String, String> FIELD_MAPPING;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("apiKey", API_KEY);
        m.put("nodeEnv", NODE_ENV);
        m.put("appEnv", APP_ENV);
        m.put("port", SERVER_PORT);
        m.put("cognito.region", AWS_COGNITO_REGION);
        m.put("cognito.userPoolId", AWS_COGNITO_USER_POOL_ID);
        m.put("cognito.userPoolClientId", AWS_COGNITO_USER_POOL_CLIENT_ID);
        m.put("cognito.userPoolSecretKey", AWS_COGNITO_USER_POOL_SECRET_KEY);
        m.put("cognito.accessKey", AWS_COGNITO_ACCESS_KEY);
        m.put("cognito.secretKey", AWS_COGNITO_SECRET_KEY);
        m.put("cognito.refreshTokenExpiryDays", AWS_COGNITO_REFRESH_TOKEN_EXPIRY);
        m.put("cookie.domain", COOKIE_DOMAIN);
        m.put("cookie.encryptionKey", COOKIE_ENCRYPTION_KEY);
        m.put("database.nonRelationalUrl", NON_RELATIONAL_DATABASE_URL);
        m.put("database.relationalUrl", RELATIONAL_DATABASE_URL);
        m.put("openaiApiKey", OPENAI_API_KEY);
        m.put("rateLimits.general.window", RATE_LIMIT_WINDOW_MS);
        m.put("rateLimits.general.maxRequests", RATE_LIMIT_MAX_REQUESTS);
        m.put("rateLimits.auth.window", AUTH_RATE_LIMIT_WINDOW_MS);
        m.put("rateLimits.auth.maxRequests", AUTH_RATE_LIMIT_MAX_REQUESTS);
        m.put("rateLimits.api.window", API_RATE_LIMIT_WINDOW_MS);
        m.put("rateLimits.api.maxRequests", API_RATE_LIMIT_MAX_REQUESTS);
        m.put("redisUrl", REDIS_URL);
        m.put("corsAllowedOrigins", CORS_ALLOWED_ORIGINS);
        FIELD_MAPPING = Collections.unmodifiableMap(m);
    }

    public AppConfig map(ValidatedConfig v) {
        Objects.requireNonNull(v, "validated config");
        return new AppConfig(
                v.string(API_KEY),
                v.string(NODE_ENV),
                v.string(APP_ENV),
                v.integer(SERVER_PORT),
                new AppConfig.Cognito(
                        v.string(AWS_COGNITO_REGION),
                        v.string(AWS_COGNITO_USER_POOL_ID),
                        v.string(AWS_COGNITO_USER_POOL_CLIENT_ID),
                        v.string(AWS_COGNITO_USER_POOL_SECRET_KEY),
                        v.string(AWS_COGNITO_ACCESS_KEY),
                        v.string(AWS_COGNITO_SECRET_KEY),
                        v.integer(AWS_COGNITO_REFRESH_TOKEN_EXPIRY)),
                new AppConfig.Cookie(v.string(COOKIE_DOMAIN), v.string(COOKIE_ENCRYPTION_KEY)),
                new AppConfig.Database(v.string(NON_RELATIONAL_DATABASE_URL), v.string(RELATIONAL_DATABASE_URL)),
                v.string(OPENAI_API_KEY),
                new AppConfig.RateLimits(
                        new AppConfig.RateLimit(v.integer(RATE_LIMIT_WINDOW_MS), v.integer(RATE_LIMIT_MAX_REQUESTS)),
                        new AppConfig.RateLimit(v.integer(AUTH_RATE_LIMIT_WINDOW_MS), v.integer(AUTH_RATE_LIMIT_MAX_REQUESTS)),
                        new AppConfig.RateLimit(v.integer(API_RATE_LIMIT_WINDOW_MS), v.integer(API_RATE_LIMIT_MAX_REQUESTS))),
                v.string(REDIS_URL),
                parseOrigins(v.string(CORS_ALLOWED_ORIGINS)));
    }

    /**
     * @param provenance 外部键名到来源，通常取自 {@link ValidatedConfig#provenance()}
     */
    public AnnotatedAppConfig annotate(AppConfig config, Map<String, ConfigSource> provenance,
                                       DeploymentContext context, Instant loadedAt) {
        Map<String, ConfigSource> sources = new LinkedHashMap<>();
        Map<ConfigSource, Integer> counts = new EnumMap<>(ConfigSource.class);
        FIELD_MAPPING.forEach((field, key) -> {
            ConfigSource source = provenance.get(key);
            if (source != null) {
                sources.put(field, source);
                counts.merge(source, 1, Integer::sum);
            }
        });
        LoadStatistics stats = new LoadStatistics(
                sources.size(),
                counts.getOrDefault(ConfigSource.ENVIRONMENT, 0),
                counts.getOrDefault(ConfigSource.LOCAL_FILE, 0),
                counts.getOrDefault(ConfigSource.REMOTE_STORE, 0),
                counts.getOrDefault(ConfigSource.FALLBACK_DEFAULT, 0));
        return new AnnotatedAppConfig(config, context, sources, loadedAt, stats);
    }

    /**
     * @return 应用字段名到外部键名
     */
    public Map<String, String> fieldMapping() {
        return FIELD_MAPPING;
    }

    /**
     * 支持 JSON 数组（{@code ["https://a","https://b"]}）或逗号分隔；空白与 null 元素被忽略。
     */
    static List<String> parseOrigins(String raw) {
        if (EnvValues.isBlank(raw)) {
            return null;
        }
        String v = raw.trim();
        if (v.startsWith("[")) {
            try {
                return JSON.readValue(v, STRING_LIST).stream()
                        .filter(EnvValues::notBlank)
                        .map(String::trim)
                        .distinct()
                        .collect(Collectors.toUnmodifiableList());
            } catch (JsonProcessingException e) {
                log.warn("CORS_ALLOWED_ORIGINS is not a valid JSON array, treating it as a comma separated list");
            }
        }
        return EnvValues.splitToUniqueList(v);
    }
}
