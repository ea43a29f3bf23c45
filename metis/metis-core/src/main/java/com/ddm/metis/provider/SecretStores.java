package com.ddm.metis.provider;

import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * {@link SecretStore} 的获取入口。
 *
 * @author liyifei
 */
public final class SecretStores {

    private static final Logger log = LoggerFactory.getLogger(SecretStores.class);

    public static final String UNCONFIGURED = "unconfigured";

    private SecretStores() {
    }

    /**
     * 通过 SPI 机制加载并初始化指定类型的 SecretStore。
     *
     * @param type    存储类型（不区分大小写），不能为 null
     * @param options 初始化参数
     * @return 已初始化的实例，不会为 null
     * @throws IllegalStateException 找不到指定类型，或初始化失败
     */
    public static SecretStore load(String type, Map<String, String> options) {
        Objects.requireNonNull(type, "store type cannot be null");
        ServiceLoader<SecretStore> loader =
                ServiceLoader.load(SecretStore.class, Thread.currentThread().getContextClassLoader());
        List<String> availableTypes = new ArrayList<>();
        SecretStore found = null;
        for (SecretStore store : loader) {
            if (type.equalsIgnoreCase(store.type())) {
                found = store;
                break;
            }
            availableTypes.add(store.type());
        }
        if (found == null) {
            String message = String.format("No SecretStore found via SPI for type '%s'. Available types: %s",
                    type, availableTypes.isEmpty() ? "none" : String.join(", ", availableTypes));
            log.error(message);
            throw new IllegalStateException(message);
        }
        try {
            found.init(options == null ? Map.of() : options);
            log.info("SecretStore '{}' initialized successfully via SPI", type);
            return found;
        } catch (RuntimeException e) {
            String message = String.format("Failed to initialize SecretStore '%s'", type);
            log.error(message, e);
            throw new IllegalStateException(message, e);
        }
    }

    /**
     * 未配置远端存储时使用，所有读取均返回 Unavailable。
     */
    public static SecretStore unconfigured() {
        return new SecretStore() {
            @Override
            public String type() {
                return UNCONFIGURED;
            }

            @Override
            public Result<String> get(String name) {
                return Result.failure(ConfigError.unavailable(name, "no remote store configured", null));
            }
        };
    }
}
