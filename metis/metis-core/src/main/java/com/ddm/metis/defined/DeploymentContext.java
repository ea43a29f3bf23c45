package com.ddm.metis.defined;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 部署上下文，每个进程由 {@code EnvironmentClassifier} 判定一次，进程生命周期内不变。
 *
 * @author liyifei
 */
public enum DeploymentContext {

    /**
     * 一次性构建工具（CI），不访问网络，不读取本地文件。
     */
    BUILD_TIME("build-time"),

    /**
     * 本地开发，读取 .env 覆盖文件。
     */
    LOCAL("local"),

    /**
     * 托管运行时（Lambda / ECS / 预览环境），需要访问远端参数存储。
     */
    MANAGED_RUNTIME("managed-runtime");

    private final String id;

    DeploymentContext(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * 按 id（{@code build-time}）或枚举名（{@code BUILD_TIME}）解析，不区分大小写。
     */
    public static Optional<DeploymentContext> fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String v = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values()).filter(c -> c.id.equals(v)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
