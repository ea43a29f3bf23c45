package com.ddm.metis.resolver;

import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.loader.RemoteFailurePolicy;


/**
 * 单次解析的选项。
 *
 * <pre>{@code
 * ResolveOptions opts = ResolveOptions.builder()
 *         .forceContext(DeploymentContext.LOCAL)
 *         .enableLogging(false)
 *         .build();
 * }</pre>
 *
 * @param forceContext        跳过判定，直接使用该上下文；null 表示自动判定
 * @param enableValidation    false 时只做类型转换（宽松模式）
 * @param enableLogging       false 时不发送阶段事件
 * @param remoteFailurePolicy null 表示使用解析器的默认策略
 * @author liyifei
 */
public record ResolveOptions(DeploymentContext forceContext,
                             boolean enableValidation,
                             boolean enableLogging,
                             RemoteFailurePolicy remoteFailurePolicy) {

    private static final ResolveOptions DEFAULTS = builder().build();

    public static ResolveOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DeploymentContext forceContext;
        private boolean enableValidation = true;
        private boolean enableLogging = true;
        private RemoteFailurePolicy remoteFailurePolicy;

        private Builder() {
        }

        public Builder forceContext(DeploymentContext context) {
            this.forceContext = context;
            return this;
        }

        public Builder enableValidation(boolean enable) {
            this.enableValidation = enable;
            return this;
        }

        public Builder enableLogging(boolean enable) {
            this.enableLogging = enable;
            return this;
        }

        public Builder remoteFailurePolicy(RemoteFailurePolicy policy) {
            this.remoteFailurePolicy = policy;
            return this;
        }

        public ResolveOptions build() {
            return new ResolveOptions(forceContext, enableValidation, enableLogging, remoteFailurePolicy);
        }
    }
}
