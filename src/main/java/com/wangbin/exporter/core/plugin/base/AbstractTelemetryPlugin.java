package com.wangbin.exporter.core.plugin.base;

import com.wangbin.exporter.common.domain.enums.MatchMode;
import com.wangbin.exporter.common.utils.MetricNameUtil;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.store.model.MetricKey;
import com.wangbin.exporter.core.transport.model.PathSubscription;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 抽象遥测插件
 */
@Slf4j
public abstract class AbstractTelemetryPlugin implements TelemetryPlugin {

    public static final String LABEL_INSTANCE = "instance_name";
    public static final String LABEL_DATA_MODEL = "data_model";
    public static final String LABEL_DEVICE = "device";

    protected final PluginContext context;

    /**
     * 已产出的指标标识 -> 来源路径，用于删除通知时撤回
     */
    private final Map<MetricKey, TrackedSource> emittedSources = new HashMap<>();

    private final long trackingTtlMillis;
    // 当前处理的更新的时间戳，track() 以此记录最后产出时刻
    private long currentTimestamp = 0L;
    private long lastPruneTimestamp = 0L;

    protected volatile boolean synced = false;

    // 统计信息
    protected final AtomicLong totalProcessed = new AtomicLong(0);
    protected final AtomicLong totalEmitted = new AtomicLong(0);
    protected final AtomicLong totalRetracted = new AtomicLong(0);
    protected final AtomicLong syncResets = new AtomicLong(0);
    protected final AtomicLong trackingExpired = new AtomicLong(0);

    protected AbstractTelemetryPlugin(PluginContext context) {
        this.context = context;
        Duration ttl = context.getTrackingTtl();
        this.trackingTtlMillis = ttl == null ? 0L : ttl.toMillis();
    }

    @Override
    public String getType() {
        return context.getPluginType();
    }

    @Override
    public MatchMode getMatchMode() {
        return context.getMatchMode();
    }

    @Override
    public List<PathSubscription> getSubscribedPaths() {
        List<SchemaPath> paths = context.getPaths().isEmpty() ? defaultPaths() : context.getPaths();
        List<PathSubscription> subscriptions = new ArrayList<>(paths.size());
        for (SchemaPath path : paths) {
            subscriptions.add(new PathSubscription(path, getOrigin()));
        }
        return subscriptions;
    }

    @Override
    public final PluginOutput process(TelemetryUpdate update) {
        totalProcessed.incrementAndGet();
        currentTimestamp = update.timestampMillis();
        PluginOutput output = doProcess(update);
        pruneExpired();
        if (output == null) {
            return PluginOutput.empty();
        }
        totalEmitted.addAndGet(output.samples().size());
        totalRetracted.addAndGet(output.retracted().size());
        return output;
    }

    @Override
    public final PluginOutput onDelete(SchemaPath path) {
        List<MetricKey> keys = retractUnder(path);
        doDelete(path);
        if (!keys.isEmpty()) {
            totalRetracted.addAndGet(keys.size());
            log.debug("删除通知撤回指标: plugin={}, target={}, path={}, count={}",
                    getType(), context.getTargetName(), path, keys.size());
        }
        return PluginOutput.retract(keys);
    }

    @Override
    public void onSyncStatusChanged(boolean synced) {
        if (!synced) {
            syncResets.incrementAndGet();
            // 重连后设备会重发全量状态，未重发的序列由缓存按时长回收
            emittedSources.clear();
            clearDerivedState();
        }
        this.synced = synced;
        log.debug("插件同步状态变更: plugin={}, target={}, synced={}", getType(), context.getTargetName(), synced);
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("type", getType());
        stats.put("synced", synced);
        stats.put("totalProcessed", totalProcessed.get());
        stats.put("totalEmitted", totalEmitted.get());
        stats.put("totalRetracted", totalRetracted.get());
        stats.put("syncResets", syncResets.get());
        stats.put("trackedSeries", emittedSources.size());
        stats.put("trackingExpired", trackingExpired.get());
        return stats;
    }

    // =============== 抽象方法 ===============

    /**
     * 插件默认订阅路径
     */
    protected abstract List<SchemaPath> defaultPaths();

    protected abstract PluginOutput doProcess(TelemetryUpdate update);

    // =============== 可覆盖方法 ===============

    protected String getOrigin() {
        return "";
    }

    /**
     * 删除通知后清理插件内部状态，撤回的指标由基类计算
     */
    protected void doDelete(SchemaPath path) {
    }

    /**
     * 流断开时清理派生状态（例如速率基线）
     */
    protected void clearDerivedState() {
    }

    /**
     * 序列超过跟踪时长被遗忘后回调，子类据此清理与这些序列相关的状态
     */
    protected void onTrackingExpired(Set<MetricKey> keys) {
    }

    // =============== 辅助方法 ===============

    /**
     * 基础标签：instance_name、data_model（有数据模型时）、device
     */
    protected Map<String, String> baseLabels(String dataModel) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_INSTANCE, context.getInstanceName());
        if (dataModel != null) {
            labels.put(LABEL_DATA_MODEL, dataModel);
        }
        labels.put(LABEL_DEVICE, context.getTargetName());
        return labels;
    }

    protected String metricName(String... parts) {
        String[] all = new String[parts.length + 1];
        all[0] = context.getMetricPrefix();
        System.arraycopy(parts, 0, all, 1, parts.length);
        return MetricNameUtil.join(all);
    }

    protected void track(MetricKey key, SchemaPath source) {
        emittedSources.put(key, new TrackedSource(source, currentTimestamp));
    }

    protected void untrack(MetricKey key) {
        emittedSources.remove(key);
    }

    private List<MetricKey> retractUnder(SchemaPath path) {
        List<MetricKey> keys = new ArrayList<>();
        Iterator<Map.Entry<MetricKey, TrackedSource>> iterator = emittedSources.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<MetricKey, TrackedSource> entry = iterator.next();
            if (entry.getValue().source().startsWith(path)) {
                keys.add(entry.getKey());
                iterator.remove();
            }
        }
        return keys;
    }

    /**
     * 每隔一个跟踪时长清理一次长期未产出的序列，例如接口改名后旧名称的序列
     */
    private void pruneExpired() {
        if (trackingTtlMillis <= 0) {
            return;
        }
        if (lastPruneTimestamp == 0L) {
            lastPruneTimestamp = currentTimestamp;
            return;
        }
        if (currentTimestamp - lastPruneTimestamp < trackingTtlMillis) {
            return;
        }
        long cutoff = currentTimestamp - trackingTtlMillis;
        Set<MetricKey> expiredKeys = new HashSet<>();
        Iterator<Map.Entry<MetricKey, TrackedSource>> iterator = emittedSources.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<MetricKey, TrackedSource> entry = iterator.next();
            if (entry.getValue().lastEmitted() < cutoff) {
                expiredKeys.add(entry.getKey());
                iterator.remove();
            }
        }
        lastPruneTimestamp = currentTimestamp;
        if (!expiredKeys.isEmpty()) {
            trackingExpired.addAndGet(expiredKeys.size());
            onTrackingExpired(expiredKeys);
            log.debug("清理长期未产出的序列: plugin={}, target={}, count={}",
                    getType(), context.getTargetName(), expiredKeys.size());
        }
    }

    private record TrackedSource(SchemaPath source, long lastEmitted) {
    }
}
