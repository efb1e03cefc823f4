package com.wangbin.exporter.core.store.model;

import java.util.Map;

/**
 * 缓存中的指标条目。不可变，每次写入整体替换，读者不会看到半更新的值。
 *
 * @param writtenNanos 写入时刻（缓存 ticker 时间），用于过期计算，标记失效时保持不变
 * @param confirmed    写入时目标会话是否已完成初始同步
 * @param stale        目标当前不可达
 */
public record MetricEntry(MetricKey key,
                          MetricType type,
                          double value,
                          long timestampMillis,
                          String help,
                          MetricOwner owner,
                          boolean confirmed,
                          boolean stale,
                          long writtenNanos) {

    public static MetricEntry of(MetricSample sample, MetricOwner owner, boolean confirmed, long writtenNanos) {
        return new MetricEntry(sample.key(), sample.type(), sample.value(), sample.timestampMillis(),
                sample.help(), owner, confirmed, false, writtenNanos);
    }

    public MetricEntry markStale() {
        if (stale) {
            return this;
        }
        return new MetricEntry(key, type, value, timestampMillis, help, owner, confirmed, true, writtenNanos);
    }

    public String name() {
        return key.name();
    }

    public Map<String, String> labels() {
        return key.labels();
    }

    public boolean ownedBy(String targetName) {
        return owner.targetName().equals(targetName);
    }
}
