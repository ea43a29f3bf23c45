package com.ddm.metis.mapper;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.DeploymentContext;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * 附带来源信息的配置，仅用于观测与排查。
 *
 * @param config     最终配置
 * @param context    部署上下文
 * @param sources    应用字段名（如 {@code port}）到来源
 * @param loadedAt   加载完成时间
 * @param statistics 按来源统计
 * @author liyifei
 */
public record AnnotatedAppConfig(AppConfig config,
                                 DeploymentContext context,
                                 Map<String, ConfigSource> sources,
                                 Instant loadedAt,
                                 LoadStatistics statistics) {

    public AnnotatedAppConfig {
        sources = Map.copyOf(sources);
    }

    public Optional<ConfigSource> sourceOf(String field) {
        return Optional.ofNullable(sources.get(field));
    }
}
