package com.ddm.metis.loader;

/**
 * 远端存储读取失败时的处理策略。
 *
 * @author liyifei
 */
public enum RemoteFailurePolicy {

    /**
     * 记录告警，降级为进程环境变量或静态回退值。
     */
    TOLERANT,

    /**
     * 远端存储是权威来源：任何必填键未能从远端解析即加载失败。
     */
    AUTHORITATIVE;

}
