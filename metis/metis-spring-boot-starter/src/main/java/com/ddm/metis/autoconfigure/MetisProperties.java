package com.ddm.metis.autoconfigure;

import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.loader.RemoteFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * 配置解析主配置绑定类，对应属性前缀：{@code metis.*}
 *
 * <p><strong>示例 YAML 配置：</strong>
 * <pre>{@code
 * metis:
 *   cache-ttl: 300
 *   remote-failure-policy: authoritative
 *   provider:
 *     type: ssm
 *     options:
 *       region: us-east-1
 *       project: macro-ai
 * }</pre>
 *
 * @author liyifei
 * @see MetisAutoConfiguration
 * @since 1.0
 */
@ConfigurationProperties(prefix = "metis")
public record MetisProperties(

        /**
         * 强制使用的部署上下文（build-time / local / managed-runtime），为空时自动判定。
         */
        String forceContext,

        @DefaultValue("true")
        boolean enableValidation,

        @DefaultValue("true")
        boolean enableLogging,

        /**
         * 远端密钥缓存 TTL，单位秒。
         */
        @DurationUnit(ChronoUnit.SECONDS)
        @DefaultValue("300")
        Duration cacheTtl,

        @DefaultValue("1024")
        long cacheMaxSize,

        /**
         * 本地覆盖文件目录，为空时使用工作目录。
         */
        String envDir,

        /**
         * 覆盖文件名（优先级升序），为空时按 NODE_ENV 推导。
         */
        List<String> envFiles,

        @DefaultValue("tolerant")
        RemoteFailurePolicy remoteFailurePolicy,

        Provider provider) {

    /**
     * 远端存储 SPI 配置。
     *
     * @param type    存储类型，如 {@code ssm}
     * @param options 传给 {@code SecretStore.init} 的参数
     */
    public record Provider(String type, Map<String, String> options) {
    }

    public DeploymentContext forcedContextOrNull() {
        if (forceContext == null || forceContext.isBlank()) {
            return null;
        }
        return DeploymentContext.fromId(forceContext)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metis.force-context: " + forceContext));
    }
}
