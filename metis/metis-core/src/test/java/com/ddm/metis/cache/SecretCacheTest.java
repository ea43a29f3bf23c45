package com.ddm.metis.cache;

import com.ddm.metis.provider.SecretStore;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import com.ddm.metis.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * {@link SecretCache} 的单元测试。
 *
 * @author liyifei
 */
class SecretCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private SecretStore mockStore;
    private MutableClock clock;
    private SecretCache cache;

    @BeforeEach
    void setUp() {
        mockStore = mock(SecretStore.class);
        when(mockStore.type()).thenReturn("mock");
        when(mockStore.batchSize()).thenReturn(10);
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        cache = new SecretCache(mockStore, TTL, 100, clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @SuppressWarnings("unchecked")
    private void stubBatch(Map<String, Result<String>> results) {
        when(mockStore.getMany(anyList())).thenAnswer(inv -> {
            Map<String, Result<String>> out = new LinkedHashMap<>();
            for (String name : (List<String>) inv.getArgument(0)) {
                out.put(name, results.get(name));
            }
            return out;
        });
    }

    @Test
    void testGet_ServedFromCacheUntilExpiry() {
        when(mockStore.get("api-key")).thenReturn(Result.success("v1"));

        assertEquals(Result.success("v1"), cache.get("api-key"));
        clock.advance(TTL.minusSeconds(1));
        assertEquals(Result.success("v1"), cache.get("api-key"));

        verify(mockStore, times(1)).get("api-key");
    }

    @Test
    void testGet_RefetchesExactlyOnceAtExpiry() {
        when(mockStore.get("api-key")).thenReturn(Result.success("v1"), Result.success("v2"));

        cache.get("api-key");
        clock.advance(TTL);
        assertEquals(Result.success("v2"), cache.get("api-key"));
        assertEquals(Result.success("v2"), cache.get("api-key"));

        verify(mockStore, times(2)).get("api-key");
    }

    @Test
    void testGet_NotFoundIsNotCached() {
        when(mockStore.get("missing")).thenReturn(Result.failure(ConfigError.notFound("missing", "/app/MISSING")));

        Result<String> result = cache.get("missing");

        assertInstanceOf(ConfigError.NotFound.class, result.errorOptional().orElseThrow());
        assertEquals(0, cache.stats().total());
    }

    @Test
    void testGet_StoreExceptionBecomesUnavailable() {
        when(mockStore.get("api-key")).thenThrow(new IllegalStateException("boom"));

        Result<String> result = cache.get("api-key");

        ConfigError error = result.errorOptional().orElseThrow();
        assertInstanceOf(ConfigError.Unavailable.class, error);
        assertEquals(0, cache.stats().total());
    }

    @Test
    void testGet_BypassCacheStillStoresValue() {
        when(mockStore.get("api-key")).thenReturn(Result.success("v1"), Result.success("v2"));

        cache.get("api-key");
        assertEquals(Result.success("v2"), cache.get("api-key", false));
        assertEquals(Result.success("v2"), cache.get("api-key"));

        verify(mockStore, times(2)).get("api-key");
    }

    @Test
    void testGetMany_PartialFailureKeepsSuccessfulValues() {
        Map<String, Result<String>> results = new LinkedHashMap<>();
        results.put("a", Result.success("value-a"));
        results.put("b", Result.failure(ConfigError.unavailable("b", "timeout", null)));
        stubBatch(results);

        SecretBatch batch = cache.getMany(List.of("a", "b")).join();

        assertEquals(Map.of("a", "value-a"), batch.values());
        assertEquals(List.of("b"), List.copyOf(batch.failedKeys()));
        assertFalse(batch.isComplete());
        assertTrue(batch.error().orElseThrow().message().contains("b"));
    }

    @Test
    void testGetMany_CachedKeysSkipRoundTrip() {
        when(mockStore.get("a")).thenReturn(Result.success("value-a"));
        cache.get("a");
        stubBatch(Map.of("b", Result.success("value-b")));

        SecretBatch batch = cache.getMany(List.of("a", "b")).join();

        assertEquals(Map.of("a", "value-a", "b", "value-b"), batch.values());
        verify(mockStore).getMany(List.of("b"));
    }

    @Test
    void testGetMany_SplitsIntoStoreBatches() {
        when(mockStore.batchSize()).thenReturn(2);
        Map<String, Result<String>> results = new LinkedHashMap<>();
        for (String k : List.of("k1", "k2", "k3", "k4", "k5")) {
            results.put(k, Result.success("v-" + k));
        }
        stubBatch(results);

        SecretBatch batch = cache.getMany(results.keySet()).join();

        assertEquals(5, batch.values().size());
        verify(mockStore, times(3)).getMany(anyList());
    }

    @Test
    void testGetMany_StoreExceptionBecomesFailure() {
        when(mockStore.getMany(anyList())).thenThrow(new IllegalStateException("boom"));

        SecretBatch batch = cache.getMany(List.of("a")).join();

        assertTrue(batch.values().isEmpty());
        assertInstanceOf(ConfigError.Unavailable.class, batch.failures().get("a"));
    }

    @Test
    void testInvalidate_IsIdempotent() {
        when(mockStore.get(anyString())).thenReturn(Result.success("v"));
        cache.get("a");
        cache.get("b");

        cache.invalidate("a");
        cache.invalidate("a");
        assertEquals(1, cache.stats().active());

        cache.invalidateAll();
        cache.invalidateAll();
        assertEquals(0, cache.stats().active());
        assertEquals(0, cache.stats().total());
    }

    @Test
    void testStats_CountsExpiredEntries() {
        when(mockStore.get(anyString())).thenReturn(Result.success("v"));
        cache.get("a");
        clock.advance(Duration.ofMinutes(3));
        cache.get("b");
        clock.advance(Duration.ofMinutes(3));

        CacheStats stats = cache.stats();

        assertEquals(2, stats.total());
        assertEquals(1, stats.active());
        assertEquals(1, stats.expired());
        assertEquals(TTL, stats.ttl());
    }

    @Test
    void testCacheEntry_OlderFetchDoesNotReplaceNewer() {
        CacheEntry older = new CacheEntry("old", clock.instant(), clock.instant().plus(TTL));
        CacheEntry newer = new CacheEntry("new", clock.instant().plusSeconds(1), clock.instant().plus(TTL).plusSeconds(1));

        assertSame(newer, CacheEntry.newer(newer, older));
        assertSame(newer, CacheEntry.newer(older, newer));
    }
}
