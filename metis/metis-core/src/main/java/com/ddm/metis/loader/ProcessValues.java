package com.ddm.metis.loader;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.schema.ConfigSchema;
import com.ddm.metis.schema.FieldSpec;

import java.util.Map;

final class ProcessValues {
    private ProcessValues() {
    }

    /**
     * 以进程环境变量为底，只取 schema 中声明的键。
     */
    static RawEnvironment.Builder base(Map<String, String> env, ConfigSchema schema) {
        RawEnvironment.Builder builder = RawEnvironment.builder();
        for (FieldSpec spec : schema.fields()) {
            String v = env.get(spec.key());
            if (v != null) {
                builder.put(spec.key(), v, ConfigSource.ENVIRONMENT);
            }
        }
        return builder;
    }
}
