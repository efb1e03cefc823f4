package com.wangbin.exporter.core.store.manager;

import com.wangbin.exporter.core.store.model.EvictionMode;
import com.wangbin.exporter.core.store.model.MetricEntry;
import com.wangbin.exporter.core.store.model.MetricFamily;
import com.wangbin.exporter.core.store.model.MetricKey;
import com.wangbin.exporter.core.store.model.MetricOwner;
import com.wangbin.exporter.core.store.model.MetricSample;
import com.wangbin.exporter.core.store.model.WriteResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 最新值指标缓存。由插件写入，抓取端只读。
 */
public interface MetricStore {

    /**
     * 写入（覆盖）一个样本。按时间戳后写胜出，时间戳更早的写入被拒绝。
     */
    WriteResult write(MetricSample sample, MetricOwner owner, boolean confirmed);

    /**
     * 时间点一致的快照，按指标名、标签排序。每个条目都是完整写入的不可变对象。
     */
    List<MetricEntry> snapshot();

    /**
     * 回收某个目标拥有的全部条目
     *
     * @return 受影响的条目数
     */
    int evictTarget(String targetName, EvictionMode mode);

    /**
     * 删除指定标识（插件撤回）
     */
    int remove(Collection<MetricKey> keys, MetricOwner owner);

    MetricFamily family(String name);

    long size();

    Map<String, Object> getStatistics();
}
