package com.ddm.metis.schema;

/**
 * 字段的目标类型。
 *
 * @author liyifei
 */
public enum FieldType {
    STRING,
    INTEGER,
    ENUM
}
