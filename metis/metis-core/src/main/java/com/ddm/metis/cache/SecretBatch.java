package com.ddm.metis.cache;

import com.ddm.metis.result.ConfigError;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 批量读取结果：成功的值与逐键失败。每个请求的键只会出现在其中一侧。
 *
 * @author liyifei
 */
public record SecretBatch(Map<String, String> values, Map<String, ConfigError> failures) {

    public SecretBatch {
        values = Map.copyOf(values);
        failures = Map.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public Set<String> failedKeys() {
        return failures.keySet();
    }

    /**
     * @return 所有失败键的合并错误；全部成功时为空
     */
    public Optional<ConfigError> error() {
        return failures.isEmpty() ? Optional.empty() : Optional.of(new ConfigError.PartialFailure(failures));
    }
}
