package com.ddm.metis.cache;

import com.ddm.metis.provider.SecretStore;
import com.ddm.metis.result.ConfigError;
import com.ddm.metis.result.Result;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 远端密钥的 TTL 缓存，位于 {@link SecretStore} 之前。
 *
 * <p>实现特性：
 * <ul>
 *   <li>Caffeine {@link Cache} 作为并发表，仅设置容量上限，过期由读取时按注入的 {@link Clock} 判断</li>
 *   <li>过期条目在读取时视为不存在，不做后台清理</li>
 *   <li>写入时比较抓取时间，旧的抓取结果不会覆盖新的</li>
 *   <li>{@link #getMany} 将未命中的键按存储的批量大小分组，在线程池上并发抓取，全部完成后返回</li>
 * </ul>
 *
 * <p><strong>线程安全：</strong>表操作都是内存操作，网络 I/O 期间不持有任何锁。
 * 同一个键的并发未命中会各自抓取（不做合并）。
 *
 * @author liyifei
 * @since 1.0
 */
public final class SecretCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SecretCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final long DEFAULT_MAX_SIZE = 1024;

    /**
     * 抓取线程池大小。
     */
    private static final int FETCH_POOL_SIZE = 4;

    private final SecretStore store;
    private final Duration ttl;
    private final Clock clock;
    private final Cache<String, CacheEntry> table;
    private final ExecutorService fetchPool;

    public SecretCache(SecretStore store) {
        this(store, DEFAULT_TTL, DEFAULT_MAX_SIZE, Clock.systemUTC());
    }

    /**
     * @param store   远端存储，不能为 null
     * @param ttl     条目存活时间，必须为正
     * @param maxSize 表容量上限
     * @param clock   时间源
     */
    public SecretCache(SecretStore store, Duration ttl, long maxSize, Clock clock) {
        this.store = Objects.requireNonNull(store, "store required");
        this.ttl = Objects.requireNonNull(ttl, "ttl required");
        this.clock = Objects.requireNonNull(clock, "clock required");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.table = Caffeine.newBuilder().maximumSize(maxSize).build();
        this.fetchPool = createFetchExecutor();

        log.info("Secret cache initialized with store '{}' (ttl={}, maxSize={})", store.type(), ttl, maxSize);
    }

    public Result<String> get(String key) {
        return get(key, true);
    }

    /**
     * @param useCache false 时跳过读表直接远端读取，但结果仍写入表中
     */
    public Result<String> get(String key, boolean useCache) {
        Objects.requireNonNull(key, "key");
        if (useCache) {
            String cached = lookup(key);
            if (cached != null) {
                log.debug("Secret {} served from cache", key);
                return Result.success(cached);
            }
        }
        Instant fetchedAt = clock.instant();
        Result<String> result;
        try {
            result = store.get(key);
        } catch (RuntimeException e) {
            log.warn("Secret store '{}' failed to fetch {}", store.type(), key, e);
            return Result.failure(ConfigError.unavailable(key, String.valueOf(e.getMessage()), e));
        }
        if (result instanceof Result.Success<String> s) {
            put(key, s.value(), fetchedAt);
        }
        return result;
    }

    /**
     * 批量读取。命中的键不发起远端调用。
     */
    public CompletableFuture<SecretBatch> getMany(Collection<String> keys) {
        Map<String, String> values = new HashMap<>();
        List<String> misses = new ArrayList<>();
        for (String key : new LinkedHashSet<>(keys)) {
            String cached = lookup(key);
            if (cached != null) {
                values.put(key, cached);
            } else {
                misses.add(key);
            }
        }
        if (misses.isEmpty()) {
            log.debug("All {} secret(s) served from cache", values.size());
            return CompletableFuture.completedFuture(new SecretBatch(values, Map.of()));
        }

        int batchSize = Math.max(1, store.batchSize());
        List<CompletableFuture<Map<String, Result<String>>>> batches = new ArrayList<>();
        for (int i = 0; i < misses.size(); i += batchSize) {
            List<String> batch = List.copyOf(misses.subList(i, Math.min(i + batchSize, misses.size())));
            batches.add(CompletableFuture.supplyAsync(() -> fetchBatch(batch), fetchPool));
        }
        log.debug("Fetching {} secret(s) in {} batch(es), {} served from cache",
                misses.size(), batches.size(), values.size());

        return CompletableFuture.allOf(batches.toArray(new CompletableFuture[0])).handle((ignored, ex) -> {
            Map<String, ConfigError> failures = new HashMap<>();
            for (int i = 0; i < batches.size(); i++) {
                CompletableFuture<Map<String, Result<String>>> f = batches.get(i);
                if (f.isCompletedExceptionally()) {
                    int from = i * batchSize;
                    for (String key : misses.subList(from, Math.min(from + batchSize, misses.size()))) {
                        failures.put(key, ConfigError.unavailable(key, "batch fetch failed", unwrap(f)));
                    }
                    continue;
                }
                f.join().forEach((key, result) -> {
                    if (result instanceof Result.Success<String> s) {
                        values.put(key, s.value());
                    } else {
                        failures.put(key, ((Result.Failure<String>) result).error());
                    }
                });
            }
            return new SecretBatch(values, failures);
        });
    }

    private Map<String, Result<String>> fetchBatch(List<String> keys) {
        Instant fetchedAt = clock.instant();
        Map<String, Result<String>> results = new HashMap<>(store.getMany(keys));
        for (String key : keys) {
            Result<String> r = results.get(key);
            if (r == null) {
                results.put(key, Result.failure(ConfigError.unavailable(key, "store returned no result", null)));
            } else if (r instanceof Result.Success<String> s) {
                put(key, s.value(), fetchedAt);
            }
        }
        return results;
    }

    private String lookup(String key) {
        CacheEntry entry = table.getIfPresent(key);
        if (entry != null && entry.isValid(clock.instant())) {
            return entry.value();
        }
        return null;
    }

    private void put(String key, String value, Instant fetchedAt) {
        CacheEntry candidate = new CacheEntry(value, fetchedAt, fetchedAt.plus(ttl));
        table.asMap().merge(key, candidate, CacheEntry::newer);
    }

    public void invalidate(String key) {
        table.invalidate(key);
        log.debug("Invalidated secret {}", key);
    }

    public void invalidateAll() {
        table.invalidateAll();
        log.info("Secret cache cleared");
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        int total = 0;
        int active = 0;
        for (CacheEntry entry : table.asMap().values()) {
            total++;
            if (entry.isValid(now)) {
                active++;
            }
        }
        return new CacheStats(total, active, total - active, ttl);
    }

    public Duration ttl() {
        return ttl;
    }

    private static Throwable unwrap(CompletableFuture<?> f) {
        try {
            f.join();
            return null;
        } catch (RuntimeException e) {
            return e.getCause() != null ? e.getCause() : e;
        }
    }

    /**
     * 创建抓取线程池，守护线程，线程名 "secret-fetch-N"。
     */
    private static ExecutorService createFetchExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(FETCH_POOL_SIZE, r -> {
            Thread t = new Thread(r, "secret-fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 关闭抓取线程池与底层存储。
     */
    @Override
    public void close() {
        log.info("Shutting down secret cache (store={})", store.type());
        fetchPool.shutdownNow();
        try {
            store.close();
        } catch (Exception e) {
            log.warn("Failed to close store '{}'", store.type(), e);
        }
    }
}
