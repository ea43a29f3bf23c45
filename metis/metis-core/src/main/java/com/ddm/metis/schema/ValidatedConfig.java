package com.ddm.metis.schema;

import com.ddm.metis.defined.ConfigSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 通过校验的强类型配置，只能由 {@link SchemaValidator} 创建。
 * <p>
 * 值按外部键名存放，类型为 {@code String} 或 {@code Integer}。
 * 严格模式下所有必填字段一定存在；宽松模式（关闭校验）下缺失字段保持缺失。
 *
 * @author liyifei
 */
public final class ValidatedConfig {

    private final Map<String, Object> values;
    private final Map<String, ConfigSource> provenance;
    private final boolean strict;

    ValidatedConfig(Map<String, Object> values, Map<String, ConfigSource> provenance, boolean strict) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        this.strict = strict;
    }

    public String string(String key) {
        Object v = values.get(key);
        return v == null ? null : v.toString();
    }

    public Integer integer(String key) {
        Object v = values.get(key);
        if (v == null || v instanceof Integer) {
            return (Integer) v;
        }
        throw new IllegalStateException("Field " + key + " is not an integer field");
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * @return 键到来源，包括默认值填充的字段（{@link ConfigSource#FALLBACK_DEFAULT}）
     */
    public Map<String, ConfigSource> provenance() {
        return provenance;
    }

    public boolean strict() {
        return strict;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidatedConfig that)) return false;
        return strict == that.strict && values.equals(that.values) && provenance.equals(that.provenance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, provenance, strict);
    }

    @Override
    public String toString() {
        return "ValidatedConfig{fields=" + values.keySet() + ", strict=" + strict + "}";
    }
}
