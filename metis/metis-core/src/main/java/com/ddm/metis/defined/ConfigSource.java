package com.ddm.metis.defined;

/**
 * 配置值来源（provenance 标签）。
 *
 * @author liyifei
 */
public enum ConfigSource {
    ENVIRONMENT("environment"),
    LOCAL_FILE("local-file"),
    REMOTE_STORE("remote-store"),
    FALLBACK_DEFAULT("fallback-default");

    private final String id;

    ConfigSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
