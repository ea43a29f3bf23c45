package com.ddm.metis.loader;

import com.ddm.metis.schema.AppSchema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 托管运行时需要从远端存储读取的敏感键清单。
 *
 * @author liyifei
 */
public final class SecretRegistry {

    private static final SecretRegistry DEFAULTS = new SecretRegistry(List.of(
            SecretMapping.required(AppSchema.API_KEY, "api-key"),
            SecretMapping.required(AppSchema.COOKIE_ENCRYPTION_KEY, "cookie-encryption-key"),
            SecretMapping.required(AppSchema.AWS_COGNITO_USER_POOL_SECRET_KEY, "cognito-user-pool-secret-key"),
            SecretMapping.required(AppSchema.AWS_COGNITO_ACCESS_KEY, "cognito-access-key"),
            SecretMapping.required(AppSchema.AWS_COGNITO_SECRET_KEY, "cognito-secret-key"),
            SecretMapping.required(AppSchema.OPENAI_API_KEY, "openai-api-key"),
            SecretMapping.required(AppSchema.RELATIONAL_DATABASE_URL, "neon-database-url"),
            SecretMapping.required(AppSchema.NON_RELATIONAL_DATABASE_URL, "upstash-redis-url"),
            SecretMapping.optional(AppSchema.REDIS_URL, "upstash-redis-url"),
            SecretMapping.required(AppSchema.AWS_COGNITO_USER_POOL_ID, "cognito-user-pool-id"),
            SecretMapping.required(AppSchema.AWS_COGNITO_USER_POOL_CLIENT_ID, "cognito-user-pool-client-id")
    ));

    private final List<SecretMapping> mappings;

    private SecretRegistry(List<SecretMapping> mappings) {
        this.mappings = List.copyOf(mappings);
    }

    public static SecretRegistry defaults() {
        return DEFAULTS;
    }

    public static SecretRegistry of(List<SecretMapping> mappings) {
        return new SecretRegistry(mappings);
    }

    public List<SecretMapping> mappings() {
        return mappings;
    }

    /**
     * @return 去重后的远端参数名，多个键可共享同一参数
     */
    public List<String> parameterNames() {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        mappings.forEach(m -> names.add(m.parameterName()));
        return List.copyOf(names);
    }

    /**
     * 为指定键设置静态回退值，返回新的清单。
     *
     * @throws IllegalArgumentException 键不在清单中
     */
    public SecretRegistry withFallback(String envKey, String value) {
        Objects.requireNonNull(envKey, "envKey");
        List<SecretMapping> out = new ArrayList<>(mappings.size());
        boolean found = false;
        for (SecretMapping m : mappings) {
            if (m.envKey().equals(envKey)) {
                out.add(m.withFallback(value));
                found = true;
            } else {
                out.add(m);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("No secret mapping for " + envKey);
        }
        return new SecretRegistry(out);
    }
}
