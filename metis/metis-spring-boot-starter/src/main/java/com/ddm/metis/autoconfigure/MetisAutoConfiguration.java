package com.ddm.metis.autoconfigure;

import com.ddm.metis.cache.SecretCache;
import com.ddm.metis.mapper.AppConfig;
import com.ddm.metis.provider.SecretStore;
import com.ddm.metis.provider.SecretStores;
import com.ddm.metis.resolver.ConfigResolutionException;
import com.ddm.metis.resolver.ConfigResolver;
import com.ddm.metis.resolver.LoggingResolutionListener;
import com.ddm.metis.resolver.ResolutionListener;
import com.ddm.metis.resolver.ResolveOptions;
import com.ddm.metis.resolver.ResolverSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Metis 配置解析的自动配置类。
 * <p>自动配置以下组件：
 * <ul>
 *   <li>{@link SecretStore}：通过 SPI 按 {@code metis.provider.type} 加载，未配置时所有远端读取均不可用</li>
 *   <li>{@link SecretCache}：远端密钥 TTL 缓存</li>
 *   <li>{@link ConfigResolver}：解析门面，进程内唯一</li>
 *   <li>{@link AppConfig}：启动时解析一次，失败则抛出 {@link ConfigResolutionException} 阻止启动</li>
 * </ul>
 *
 * @author liyifei
 * @see ConfigResolver
 * @since 1.0
 */
@AutoConfiguration
@EnableConfigurationProperties(MetisProperties.class)
public class MetisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MetisAutoConfiguration.class);

    /**
     * 存储由 {@link SecretCache} 在关闭时一并关闭。
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public SecretStore metisSecretStore(MetisProperties props) {
        MetisProperties.Provider provider = props.provider();
        if (provider == null || provider.type() == null || provider.type().isBlank()) {
            log.info("No metis.provider.type configured, remote secret lookups are disabled");
            return SecretStores.unconfigured();
        }
        return SecretStores.load(provider.type(), provider.options());
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretCache metisSecretCache(SecretStore store, MetisProperties props) {
        return new SecretCache(store, props.cacheTtl(), props.cacheMaxSize(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResolutionListener metisResolutionListener() {
        return new LoggingResolutionListener();
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public ConfigResolver metisConfigResolver(MetisProperties props, SecretCache cache,
                                              ObjectProvider<ResolutionListener> listener) {
        ResolverSettings.Builder settings = ResolverSettings.builder()
                .policy(props.remoteFailurePolicy())
                .localFiles(props.envFiles());
        if (props.envDir() != null && !props.envDir().isBlank()) {
            settings.envDir(Path.of(props.envDir()));
        }
        return new ConfigResolver(settings.build(), cache, listener.getIfAvailable(LoggingResolutionListener::new));
    }

    /**
     * 启动时解析配置。托管运行时需要远端读取，这里等待异步结果完成。
     *
     * @throws ConfigResolutionException 解析失败
     */
    @Bean
    @ConditionalOnMissingBean
    public AppConfig metisAppConfig(ConfigResolver resolver, MetisProperties props) {
        ResolveOptions options = ResolveOptions.builder()
                .forceContext(props.forcedContextOrNull())
                .enableValidation(props.enableValidation())
                .enableLogging(props.enableLogging())
                .build();
        return resolver.resolve(options).join().getOrThrow(error -> {
            log.error("Configuration resolution failed, refusing to start: {}", error.message());
            return new ConfigResolutionException(error);
        });
    }
}
