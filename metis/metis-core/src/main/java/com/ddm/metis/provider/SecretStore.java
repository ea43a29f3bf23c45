package com.ddm.metis.provider;

import com.ddm.metis.result.Result;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 远端密钥/参数存储的抽象，负责按逻辑名称（如 {@code api-key}）读取值。
 *
 * <p><strong>职责：</strong>
 * <ul>
 *   <li>单个读取 {@link #get(String)} 与批量读取 {@link #getMany(List)}</li>
 *   <li>以 {@link #type()} 标识自身类型，便于 SPI 发现</li>
 *   <li>管理客户端生命周期（初始化、关闭）</li>
 * </ul>
 *
 * <p><strong>错误约定：</strong>
 * 不抛出异常，失败以 {@link Result} 返回：
 * 参数不存在为 {@code ConfigError.NotFound}，网络、权限、超时等为 {@code ConfigError.Unavailable}。
 *
 * <p>实现类应该是线程安全的，缓存层会在多个线程上并发调用。
 *
 * @author liyifei
 * @since 1.0
 */
public interface SecretStore extends AutoCloseable {

    String type();

    /**
     * 使用配置参数初始化客户端。
     *
     * @param options 提供者参数，如 region、prefix
     * @throws IllegalArgumentException 参数不合法
     */
    default void init(Map<String, String> options) {
    }

    Result<String> get(String name);

    /**
     * 批量读取，一次调用最多 {@link #batchSize()} 个名称。
     *
     * @return 每个请求名称恰好对应一个结果
     */
    default Map<String, Result<String>> getMany(List<String> names) {
        Map<String, Result<String>> out = new LinkedHashMap<>();
        for (String name : names) {
            out.put(name, get(name));
        }
        return out;
    }

    default int batchSize() {
        return 1;
    }

    @Override
    default void close() {
        // 默认无操作，由具体实现类重写
    }
}
