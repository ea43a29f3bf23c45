package com.ddm.metis.schema;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 单个配置字段的声明。
 *
 * <p>通过静态工厂与链式方法构建：
 * <pre>{@code
 * FieldSpec.integer("SERVER_PORT").range(1, 65535).withDefault("3040")
 * FieldSpec.string("API_KEY").mandatory().secret()
 * FieldSpec.oneOf("NODE_ENV", "development", "production", "test").withDefault("development")
 * }</pre>
 *
 * <p>实例不可变，每个链式方法返回新实例。
 *
 * @param key           外部键名
 * @param type          目标类型
 * @param required      缺失即失败
 * @param sensitive     违规信息与日志中隐藏值
 * @param allowedValues ENUM 的可选值，其它类型为空集合
 * @param pattern       STRING 的完整匹配正则，可为 null
 * @param min           INTEGER 下界（含），可为 null
 * @param max           INTEGER 上界（含），可为 null
 * @param defaultValue  缺失时的默认原始值，可为 null
 * @author liyifei
 */
public record FieldSpec(String key,
                        FieldType type,
                        boolean required,
                        boolean sensitive,
                        Set<String> allowedValues,
                        Pattern pattern,
                        Integer min,
                        Integer max,
                        String defaultValue) {

    public FieldSpec {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        allowedValues = Set.copyOf(allowedValues);
    }

    public static FieldSpec string(String key) {
        return new FieldSpec(key, FieldType.STRING, false, false, Set.of(), null, null, null, null);
    }

    public static FieldSpec integer(String key) {
        return new FieldSpec(key, FieldType.INTEGER, false, false, Set.of(), null, null, null, null);
    }

    public static FieldSpec oneOf(String key, String... values) {
        return new FieldSpec(key, FieldType.ENUM, false, false,
                new LinkedHashSet<>(List.of(values)), null, null, null, null);
    }

    public FieldSpec mandatory() {
        return new FieldSpec(key, type, true, sensitive, allowedValues, pattern, min, max, defaultValue);
    }

    public FieldSpec secret() {
        return new FieldSpec(key, type, required, true, allowedValues, pattern, min, max, defaultValue);
    }

    public FieldSpec matching(String regex) {
        return new FieldSpec(key, type, required, sensitive, allowedValues, Pattern.compile(regex), min, max, defaultValue);
    }

    public FieldSpec range(int min, int max) {
        return new FieldSpec(key, type, required, sensitive, allowedValues, pattern, min, max, defaultValue);
    }

    public FieldSpec positive() {
        return new FieldSpec(key, type, required, sensitive, allowedValues, pattern, 1, max, defaultValue);
    }

    public FieldSpec withDefault(String value) {
        return new FieldSpec(key, type, required, sensitive, allowedValues, pattern, min, max, value);
    }

}
