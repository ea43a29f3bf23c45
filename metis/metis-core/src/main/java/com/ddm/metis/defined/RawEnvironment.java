package com.ddm.metis.defined;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 未校验的原始键值集合，附带每个键的来源。
 * <p>
 * 键唯一，合并时后写覆盖先写，来源同步更新为最后一次写入的来源，
 * 因此"每个键恰好有一条 provenance"由构造方式保证。
 *
 * <p>实例本身不可变，通过 {@link Builder} 逐层构建：
 * <pre>{@code
 * RawEnvironment env = RawEnvironment.builder()
 *         .putAll(System.getenv(), ConfigSource.ENVIRONMENT)
 *         .putAll(fileValues, ConfigSource.LOCAL_FILE)
 *         .build();
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public final class RawEnvironment {

    private final Map<String, String> values;
    private final Map<String, ConfigSource> provenance;

    private RawEnvironment(Map<String, String> values, Map<String, ConfigSource> provenance) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.values.putAll(values);
        b.provenance.putAll(provenance);
        return b;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<ConfigSource> sourceOf(String key) {
        return Optional.ofNullable(provenance.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public Map<String, ConfigSource> provenance() {
        return provenance;
    }

    /**
     * 按来源统计键数量，所有来源都会出现（没有则为 0）。
     */
    public Map<ConfigSource, Integer> countBySource() {
        Map<ConfigSource, Integer> counts = new EnumMap<>(ConfigSource.class);
        for (ConfigSource s : ConfigSource.values()) {
            counts.put(s, 0);
        }
        provenance.values().forEach(s -> counts.merge(s, 1, Integer::sum));
        return counts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawEnvironment that)) return false;
        return values.equals(that.values) && provenance.equals(that.provenance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, provenance);
    }

    @Override
    public String toString() {
        // 不输出值，避免泄露密钥
        return "RawEnvironment" + provenance;
    }

    public static final class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();
        private final Map<String, ConfigSource> provenance = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, String value, ConfigSource source) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(source, "source");
            // 重新插入以保持"最后写入"的顺序
            values.remove(key);
            provenance.remove(key);
            values.put(key, value);
            provenance.put(key, source);
            return this;
        }

        public Builder putAll(Map<String, String> entries, ConfigSource source) {
            entries.forEach((k, v) -> {
                if (k != null && v != null) {
                    put(k, v, source);
                }
            });
            return this;
        }

        public boolean contains(String key) {
            return values.containsKey(key);
        }

        public RawEnvironment build() {
            return new RawEnvironment(values, provenance);
        }
    }
}
