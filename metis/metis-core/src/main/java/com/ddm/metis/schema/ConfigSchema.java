package com.ddm.metis.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 有序的字段声明集合，键唯一。
 *
 * @author liyifei
 */
public final class ConfigSchema {

    private final Map<String, FieldSpec> fields;

    private ConfigSchema(Map<String, FieldSpec> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static ConfigSchema of(FieldSpec... specs) {
        return of(List.of(specs));
    }

    public static ConfigSchema of(List<FieldSpec> specs) {
        Map<String, FieldSpec> map = new LinkedHashMap<>();
        for (FieldSpec spec : specs) {
            if (map.putIfAbsent(spec.key(), spec) != null) {
                throw new IllegalArgumentException("Duplicate field in schema: " + spec.key());
            }
        }
        return new ConfigSchema(map);
    }

    public List<FieldSpec> fields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldSpec> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public int size() {
        return fields.size();
    }
}
