package com.ddm.metis.resolver;

import com.ddm.metis.result.ConfigError;

/**
 * 进程启动阶段解析失败时抛出，阻止应用继续启动。
 *
 * @author liyifei
 */
public class ConfigResolutionException extends RuntimeException {

    private final transient ConfigError error;

    public ConfigResolutionException(ConfigError error) {
        super(error.message(), error.cause().orElse(null));
        this.error = error;
    }

    public ConfigError error() {
        return error;
    }
}
