package com.ddm.metis.mapper;

/**
 * 各来源的字段数量。
 *
 * @author liyifei
 */
public record LoadStatistics(int totalFields, int environmentFields, int localFileFields,
                             int remoteStoreFields, int defaultFields) {
}
