package com.ddm.metis.schema;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * 按 {@link ConfigSchema} 校验原始键值并转换类型。
 *
 * <p>处理规则：
 * <ul>
 *   <li>空白值等同缺失</li>
 *   <li>缺失且有默认值：使用默认值，来源记为 {@link ConfigSource#FALLBACK_DEFAULT}</li>
 *   <li>缺失且必填：违规</li>
 *   <li>INTEGER 转换失败：违规（严格与宽松模式都检查）</li>
 *   <li>取值范围、可选值、正则：仅严格模式检查</li>
 * </ul>
 * 结果要么是完整的 {@link ValidatedConfig}，要么是列出全部违规的
 * {@link ConfigError.ValidationError}，不会返回部分结果。
 *
 * @author liyifei
 * @since 1.0
 */
public final class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private final ConfigSchema schema;

    public SchemaValidator(ConfigSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public ConfigSchema schema() {
        return schema;
    }

    public Result<ValidatedConfig> validate(RawEnvironment env) {
        return validate(env, true);
    }

    /**
     * @param env    原始键值
     * @param strict false 时只做类型转换，跳过必填、范围和格式约束
     */
    public Result<ValidatedConfig> validate(RawEnvironment env, boolean strict) {
        Objects.requireNonNull(env, "env");
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, ConfigSource> provenance = new LinkedHashMap<>();
        List<Violation> violations = new ArrayList<>();

        for (FieldSpec spec : schema.fields()) {
            String raw = env.get(spec.key()).map(String::trim).filter(s -> !s.isEmpty()).orElse(null);
            ConfigSource source = raw == null ? null : env.sourceOf(spec.key()).orElse(ConfigSource.ENVIRONMENT);

            if (raw == null && spec.defaultValue() != null) {
                raw = spec.defaultValue();
                source = ConfigSource.FALLBACK_DEFAULT;
            }
            if (raw == null) {
                if (strict && spec.required()) {
                    violations.add(Violation.missing(spec));
                }
                continue;
            }

            Object converted = convert(spec, raw, strict, violations);
            if (converted != null) {
                values.put(spec.key(), converted);
                provenance.put(spec.key(), source);
            }
        }

        if (!violations.isEmpty()) {
            log.debug("Schema validation found {} violation(s)", violations.size());
            return Result.failure(new ConfigError.ValidationError(violations));
        }
        return Result.success(new ValidatedConfig(values, provenance, strict));
    }

    private static Object convert(FieldSpec spec, String raw, boolean strict, List<Violation> violations) {
        switch (spec.type()) {
            case INTEGER: {
                Integer n;
                try {
                    n = Integer.valueOf(raw);
                } catch (NumberFormatException e) {
                    violations.add(Violation.of(spec, "must be an integer", raw));
                    return null;
                }
                if (strict && spec.min() != null && n < spec.min()) {
                    violations.add(Violation.of(spec, "must be >= " + spec.min(), raw));
                    return null;
                }
                if (strict && spec.max() != null && n > spec.max()) {
                    violations.add(Violation.of(spec, "must be <= " + spec.max(), raw));
                    return null;
                }
                return n;
            }
            case ENUM: {
                if (strict && !spec.allowedValues().contains(raw)) {
                    violations.add(Violation.of(spec, "must be one of " + new TreeSet<>(spec.allowedValues()), raw));
                    return null;
                }
                return raw;
            }
            default: {
                if (strict && spec.pattern() != null && !spec.pattern().matcher(raw).matches()) {
                    violations.add(Violation.of(spec, "must match " + spec.pattern().pattern(), raw));
                    return null;
                }
                return raw;
            }
        }
    }
}
