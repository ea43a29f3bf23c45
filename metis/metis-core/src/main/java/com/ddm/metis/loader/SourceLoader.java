package com.ddm.metis.loader;

import com.ddm.metis.defined.DeploymentContext;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;

import java.util.concurrent.CompletableFuture;

/**
 * 按部署上下文收集原始键值的加载器。
 * <p>
 * 同步加载器实现 {@link #load()}；需要网络的加载器返回 {@code isAsync() == true}，
 * 实现 {@link #loadAsync()}，其 {@link #load()} 返回 {@link ConfigError.UsageError}。
 *
 * @author liyifei
 */
public interface SourceLoader {

    DeploymentContext context();

    default boolean isAsync() {
        return false;
    }

    Result<RawEnvironment> load();

    default CompletableFuture<Result<RawEnvironment>> loadAsync() {
        return CompletableFuture.completedFuture(load());
    }
}
