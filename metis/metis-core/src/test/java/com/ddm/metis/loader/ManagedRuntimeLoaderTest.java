package com.ddm.metis.loader;

import com.ddm.metis.cache.SecretCache;
import com.ddm.metis.defined.ConfigSource;
import com.ddm.metis.defined.RawEnvironment;
import com.ddm.metis.provider.SecretStore;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import com.ddm.metis.schema.AppSchema;
import com.ddm.metis.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * {@link ManagedRuntimeLoader} 的单元测试。
 *
 * @author liyifei
 */
class ManagedRuntimeLoaderTest {

    private SecretStore mockStore;
    private SecretCache cache;
    private final List<ConfigError.RemoteFetchWarning> warnings = new ArrayList<>();

    @BeforeEach
    void setUp() {
        mockStore = mock(SecretStore.class);
        when(mockStore.type()).thenReturn("mock");
        when(mockStore.batchSize()).thenReturn(10);
        cache = new SecretCache(mockStore, Duration.ofMinutes(5), 100, MutableClock.startingAt("2025-01-01T00:00:00Z"));
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    /**
     * 仅 {@code available} 中的参数可读，其余返回 Unavailable。
     */
    @SuppressWarnings("unchecked")
    private void remoteHas(Map<String, String> available) {
        when(mockStore.getMany(anyList())).thenAnswer(inv -> {
            Map<String, Result<String>> out = new LinkedHashMap<>();
            for (String name : (List<String>) inv.getArgument(0)) {
                String v = available.get(name);
                out.put(name, v != null ? Result.success(v)
                        : Result.failure(ConfigError.unavailable(name, "connection refused", null)));
            }
            return out;
        });
    }

    private ManagedRuntimeLoader loader(Map<String, String> env, SecretRegistry registry, RemoteFailurePolicy policy) {
        return new ManagedRuntimeLoader(env, AppSchema.SCHEMA, cache, registry, policy, warnings::add);
    }

    @Test
    void testLoad_RemoteValuesOverrideProcessValues() {
        remoteHas(Map.of("api-key", "remote-key", "openai-api-key", "sk-remote"));

        RawEnvironment raw = loader(Map.of("API_KEY", "env-key", "SERVER_PORT", "8080"),
                SecretRegistry.defaults(), RemoteFailurePolicy.TOLERANT)
                .loadAsync().join().toOptional().orElseThrow();

        assertEquals("remote-key", raw.get("API_KEY").orElseThrow());
        assertEquals(ConfigSource.REMOTE_STORE, raw.sourceOf("API_KEY").orElseThrow());
        assertEquals(ConfigSource.ENVIRONMENT, raw.sourceOf("SERVER_PORT").orElseThrow());
    }

    @Test
    void testLoad_TolerantFallsBackAndWarns() {
        remoteHas(Map.of("api-key", "remote-key"));
        SecretRegistry registry = SecretRegistry.defaults().withFallback("OPENAI_API_KEY", "sk-fallback");

        RawEnvironment raw = loader(Map.of("COOKIE_ENCRYPTION_KEY", "env-cookie"), registry, RemoteFailurePolicy.TOLERANT)
                .loadAsync().join().toOptional().orElseThrow();

        assertEquals("sk-fallback", raw.get("OPENAI_API_KEY").orElseThrow());
        assertEquals(ConfigSource.FALLBACK_DEFAULT, raw.sourceOf("OPENAI_API_KEY").orElseThrow());
        assertEquals("env-cookie", raw.get("COOKIE_ENCRYPTION_KEY").orElseThrow());
        assertEquals(ConfigSource.ENVIRONMENT, raw.sourceOf("COOKIE_ENCRYPTION_KEY").orElseThrow());
        // 共 11 个映射，只有 API_KEY 成功
        assertEquals(10, warnings.size());
        assertTrue(warnings.stream().anyMatch(w -> w.key().equals("OPENAI_API_KEY")
                && w.outcome().equals("using static fallback")));
    }

    @Test
    void testLoad_AuthoritativeListsEveryUnresolvedRequiredKey() {
        Map<String, String> available = new LinkedHashMap<>();
        for (SecretMapping m : SecretRegistry.defaults().mappings()) {
            available.put(m.parameterName(), "v");
        }
        available.remove("openai-api-key");
        available.remove("cognito-access-key");
        remoteHas(available);

        Result<RawEnvironment> result = loader(Map.of("OPENAI_API_KEY", "env-value"),
                SecretRegistry.defaults(), RemoteFailurePolicy.AUTHORITATIVE).loadAsync().join();

        ConfigError.SourceLoadError error = (ConfigError.SourceLoadError) result.errorOptional().orElseThrow();
        assertEquals(List.of("AWS_COGNITO_ACCESS_KEY", "OPENAI_API_KEY"),
                error.unresolvedKeys().stream().sorted().toList());
    }

    @Test
    void testLoad_AuthoritativeToleratesOptionalKeys() {
        SecretRegistry registry = SecretRegistry.of(List.of(
                SecretMapping.required("API_KEY", "api-key"),
                SecretMapping.optional("REDIS_URL", "redis-url")));
        remoteHas(Map.of("api-key", "k"));

        Result<RawEnvironment> result = loader(Map.of(), registry, RemoteFailurePolicy.AUTHORITATIVE).loadAsync().join();

        assertTrue(result.isSuccess());
        assertEquals(1, warnings.size());
    }

    @Test
    void testLoad_SharedParameterFetchedOnce() {
        SecretRegistry registry = SecretRegistry.of(List.of(
                SecretMapping.required("NON_RELATIONAL_DATABASE_URL", "upstash-redis-url"),
                SecretMapping.optional("REDIS_URL", "upstash-redis-url")));
        remoteHas(Map.of("upstash-redis-url", "redis://remote"));

        RawEnvironment raw = loader(Map.of(), registry, RemoteFailurePolicy.TOLERANT)
                .loadAsync().join().toOptional().orElseThrow();

        assertEquals("redis://remote", raw.get("REDIS_URL").orElseThrow());
        assertEquals("redis://remote", raw.get("NON_RELATIONAL_DATABASE_URL").orElseThrow());
        verify(mockStore).getMany(List.of("upstash-redis-url"));
    }

    @Test
    void testLoad_SyncPathIsUsageError() {
        Result<RawEnvironment> result = loader(Map.of(), SecretRegistry.defaults(), RemoteFailurePolicy.TOLERANT).load();

        assertInstanceOf(ConfigError.UsageError.class, result.errorOptional().orElseThrow());
    }
}
