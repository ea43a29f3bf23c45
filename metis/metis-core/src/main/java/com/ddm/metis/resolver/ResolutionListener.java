package com.ddm.metis.resolver;

/**
 * 解析阶段事件的接收方。实现不应抛出异常。
 *
 * @author liyifei
 */
@FunctionalInterface
public interface ResolutionListener {

    ResolutionListener NOOP = event -> {
    };

    void onStage(StageEvent event);
}
