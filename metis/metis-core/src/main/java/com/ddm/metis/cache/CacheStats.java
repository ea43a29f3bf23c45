package com.ddm.metis.cache;

import java.time.Duration;

/**
 * 缓存快照统计。
 *
 * @param total   表中条目数（含已过期未清理的）
 * @param active  未过期条目数
 * @param expired 已过期条目数
 * @param ttl     条目存活时间
 * @author liyifei
 */
public record CacheStats(int total, int active, int expired, Duration ttl) {
}
