package com.ddm.metis.mapper;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 面向应用的最终配置，只能由 {@link ConfigMapper} 创建。
 * <p>
 * 关闭校验时（宽松模式）缺失的字段为 null。
 *
 * @author liyifei
 */
public final class AppConfig {

    /**
     * @param window      时间窗口（毫秒）
     * @param maxRequests 窗口内最大请求数
     */
    public record RateLimit(Integer window, Integer maxRequests) {
    }

    public record RateLimits(RateLimit general, RateLimit auth, RateLimit api) {
    }

    public record Cognito(String region,
                          String userPoolId,
                          String userPoolClientId,
                          String userPoolSecretKey,
                          String accessKey,
                          String secretKey,
                          Integer refreshTokenExpiryDays) {
        @Override
        public String toString() {
            return "Cognito{region=" + region + ", userPoolId=" + userPoolId + ", userPoolClientId="
                    + userPoolClientId + ", refreshTokenExpiryDays=" + refreshTokenExpiryDays + "}";
        }
    }

    public record Cookie(String domain, String encryptionKey) {
        @Override
        public String toString() {
            return "Cookie{domain=" + domain + "}";
        }
    }

    public record Database(String nonRelationalUrl, String relationalUrl) {
        @Override
        public String toString() {
            return "Database{***}";
        }
    }

    private final String apiKey;
    private final String nodeEnv;
    private final String appEnv;
    private final Integer port;
    private final Cognito cognito;
    private final Cookie cookie;
    private final Database database;
    private final String openaiApiKey;
    private final RateLimits rateLimits;
    private final String redisUrl;
    private final List<String> corsAllowedOrigins;

    AppConfig(String apiKey, String nodeEnv, String appEnv, Integer port, Cognito cognito, Cookie cookie,
              Database database, String openaiApiKey, RateLimits rateLimits, String redisUrl,
              List<String> corsAllowedOrigins) {
        this.apiKey = apiKey;
        this.nodeEnv = nodeEnv;
        this.appEnv = appEnv;
        this.port = port;
        this.cognito = Objects.requireNonNull(cognito, "cognito");
        this.cookie = Objects.requireNonNull(cookie, "cookie");
        this.database = Objects.requireNonNull(database, "database");
        this.openaiApiKey = openaiApiKey;
        this.rateLimits = Objects.requireNonNull(rateLimits, "rateLimits");
        this.redisUrl = redisUrl;
        this.corsAllowedOrigins = corsAllowedOrigins == null ? null : List.copyOf(corsAllowedOrigins);
    }

    public String apiKey() {
        return apiKey;
    }

    public String nodeEnv() {
        return nodeEnv;
    }

    public String appEnv() {
        return appEnv;
    }

    public Integer port() {
        return port;
    }

    public Cognito cognito() {
        return cognito;
    }

    public Cookie cookie() {
        return cookie;
    }

    public Database database() {
        return database;
    }

    public String openaiApiKey() {
        return openaiApiKey;
    }

    public RateLimits rateLimits() {
        return rateLimits;
    }

    public Optional<String> redisUrl() {
        return Optional.ofNullable(redisUrl);
    }

    public Optional<List<String>> corsAllowedOrigins() {
        return Optional.ofNullable(corsAllowedOrigins);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppConfig that)) return false;
        return Objects.equals(apiKey, that.apiKey)
                && Objects.equals(nodeEnv, that.nodeEnv)
                && Objects.equals(appEnv, that.appEnv)
                && Objects.equals(port, that.port)
                && cognito.equals(that.cognito)
                && cookie.equals(that.cookie)
                && database.equals(that.database)
                && Objects.equals(openaiApiKey, that.openaiApiKey)
                && rateLimits.equals(that.rateLimits)
                && Objects.equals(redisUrl, that.redisUrl)
                && Objects.equals(corsAllowedOrigins, that.corsAllowedOrigins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiKey, nodeEnv, appEnv, port, cognito, cookie, database, openaiApiKey,
                rateLimits, redisUrl, corsAllowedOrigins);
    }

    @Override
    public String toString() {
        // 不输出密钥
        return "AppConfig{nodeEnv=" + nodeEnv + ", appEnv=" + appEnv + ", port=" + port + ", " + cognito
                + ", " + cookie + ", rateLimits=" + rateLimits + ", corsAllowedOrigins=" + corsAllowedOrigins + "}";
    }
}
