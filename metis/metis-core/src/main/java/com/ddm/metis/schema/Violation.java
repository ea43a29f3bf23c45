package com.ddm.metis.schema;

import java.util.Objects;

/**
 * 单个字段的校验失败记录。
 *
 * @param field          外部键名，如 {@code SERVER_PORT}
 * @param constraint     未满足的约束描述
 * @param offendingValue 违规值；敏感字段为 {@code ***}，缺失时为 null
 * @author liyifei
 */
public record Violation(String field, String constraint, String offendingValue) {

    static final String MASK = "***";

    public Violation {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(constraint, "constraint");
    }

    static Violation missing(FieldSpec spec) {
        return new Violation(spec.key(), "is required", null);
    }

    static Violation of(FieldSpec spec, String constraint, String value) {
        return new Violation(spec.key(), constraint, spec.sensitive() && value != null ? MASK : value);
    }

    public String describe() {
        return offendingValue == null
                ? field + " " + constraint
                : field + " " + constraint + " (got '" + offendingValue + "')";
    }
}
