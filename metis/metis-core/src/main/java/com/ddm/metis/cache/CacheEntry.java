package com.ddm.metis.cache;

import java.time.Instant;

/**
 * 缓存条目。{@code now < expiresAt} 时有效。
 *
 * @author liyifei
 */
record CacheEntry(String value, Instant fetchedAt, Instant expiresAt) {

    boolean isValid(Instant now) {
        return now.isBefore(expiresAt);
    }

    /**
     * 仅接受更新的抓取结果，用于并发写入时的合并。
     */
    static CacheEntry newer(CacheEntry current, CacheEntry candidate) {
        return candidate.fetchedAt.isAfter(current.fetchedAt) ? candidate : current;
    }

    @Override
    public String toString() {
        return "CacheEntry{fetchedAt=" + fetchedAt + ", expiresAt=" + expiresAt + "}";
    }
}
