package com.ddm.metis.loader;

import java.util.Objects;

/**
 * 环境变量名与远端参数名的对应关系。
 *
 * @param envKey        写入 RawEnvironment 的键，如 {@code API_KEY}
 * @param parameterName 远端逻辑参数名，如 {@code api-key}
 * @param required      必填键；权威策略下未解析即失败
 * @param fallback      远端不可用时的静态回退值，可为 null
 * @author liyifei
 */
public record SecretMapping(String envKey, String parameterName, boolean required, String fallback) {

    public SecretMapping {
        Objects.requireNonNull(envKey, "envKey");
        Objects.requireNonNull(parameterName, "parameterName");
    }

    public static SecretMapping required(String envKey, String parameterName) {
        return new SecretMapping(envKey, parameterName, true, null);
    }

    public static SecretMapping optional(String envKey, String parameterName) {
        return new SecretMapping(envKey, parameterName, false, null);
    }

    public SecretMapping withFallback(String value) {
        return new SecretMapping(envKey, parameterName, required, value);
    }

    @Override
    public String toString() {
        return envKey + "<-" + parameterName + (required ? "" : "?") + (fallback != null ? "(fallback)" : "");
    }
}
