package com.ddm.metis.resolver;

import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.defined.ResolutionStage;

import java.time.Instant;
import java.util.Map;

/**
 * 单个阶段结束时发出的观测事件。
 *
 * @param stage      阶段
 * @param context    部署上下文，判定完成前为 null
 * @param at         事件时间
 * @param durationMs 阶段耗时
 * @param success    阶段是否成功
 * @param error      失败原因，成功时为 null
 * @param counts     按来源统计的键数量，仅加载与映射阶段有值
 * @author liyifei
 */
public record StageEvent(ResolutionStage stage,
                         DeploymentContext context,
                         Instant at,
                         long durationMs,
                         boolean success,
                         String error,
                         Map<ConfigSource, Integer> counts) {

    public StageEvent {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
    }
}
