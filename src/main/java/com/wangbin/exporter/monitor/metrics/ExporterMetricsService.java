package com.wangbin.exporter.monitor.metrics;

import com.wangbin.exporter.common.domain.enums.SessionState;
import com.wangbin.exporter.core.config.ExporterProperties;
import com.wangbin.exporter.core.manager.TargetManager;
import com.wangbin.exporter.core.session.SubscriptionSession;
import com.wangbin.exporter.core.store.manager.MetricStore;
import com.wangbin.exporter.core.store.model.MetricEntry;
import com.wangbin.exporter.core.store.model.MetricOwner;
import com.wangbin.exporter.core.store.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 抓取入口：指标缓存快照 + 导出器自身指标
 */
@Slf4j
@Service
public class ExporterMetricsService {

    private static final MetricOwner SELF = new MetricOwner("exporter", "self");

    private final ExporterProperties properties;
    private final MetricStore metricStore;
    private final TargetManager targetManager;
    private final PrometheusTextWriter writer;

    public ExporterMetricsService(ExporterProperties properties, MetricStore metricStore, TargetManager targetManager) {
        this.properties = properties;
        this.metricStore = metricStore;
        this.targetManager = targetManager;
        this.writer = new PrometheusTextWriter(true);
    }

    public String scrape() {
        long start = System.currentTimeMillis();
        List<MetricEntry> entries = collect();
        String text = writer.write(entries);
        log.debug("抓取完成: series={}, time={}ms", entries.size(), System.currentTimeMillis() - start);
        return text;
    }

    /**
     * 快照中的条目（失效条目按配置过滤）加上自身指标，按名称排序
     */
    public List<MetricEntry> collect() {
        boolean exposeStale = properties.getStore().isExposeStale();
        List<MetricEntry> exported = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (MetricEntry entry : metricStore.snapshot()) {
            if (entry.stale() && !exposeStale) {
                continue;
            }
            exported.add(entry);
            names.add(entry.name());
        }

        List<MetricEntry> self = selfMetrics(names.size(), exported.size());
        List<MetricEntry> all = new ArrayList<>(exported.size() + self.size());
        all.addAll(exported);
        all.addAll(self);
        all.sort((a, b) -> a.key().compareTo(b.key()));
        return all;
    }

    private List<MetricEntry> selfMetrics(int collectedMetrics, int collectedSeries) {
        long now = System.currentTimeMillis();
        String prefix = properties.getMetricPrefix();
        Map<String, String> instance = Map.of("instance_name", properties.getInstanceName());

        List<SubscriptionSession> sessions = targetManager.getSessions();
        int streaming = 0;
        int plugins = 0;
        List<MetricEntry> entries = new ArrayList<>();
        for (SubscriptionSession session : sessions) {
            boolean up = session.getState() == SessionState.STREAMING;
            if (up) {
                streaming++;
                plugins += session.getDispatcher().getPlugins().size();
            }
            Map<String, String> labels = new LinkedHashMap<>(instance);
            labels.put("device", session.getTargetName());
            entries.add(gauge(prefix + "_target_up", labels, up ? 1 : 0, now,
                    "Whether the device subscription is streaming"));
            entries.add(gauge(prefix + "_target_synced", labels, session.isSynced() ? 1 : 0, now,
                    "Whether the device completed its initial sync"));
        }

        entries.add(gauge(prefix + "_configured_devices", instance, properties.getDevices().size(), now,
                "Number of configured devices"));
        entries.add(gauge(prefix + "_collected_devices", instance, streaming, now,
                "Number of actively monitored devices"));
        entries.add(gauge(prefix + "_collected_plugins", instance, plugins, now,
                "Number of actively monitored plugin instances"));
        entries.add(gauge(prefix + "_collected_metrics", instance, collectedMetrics, now,
                "Number of collected metrics"));
        entries.add(gauge(prefix + "_collected_series", instance, collectedSeries, now,
                "Number of collected series"));
        return entries;
    }

    private static MetricEntry gauge(String name, Map<String, String> labels, double value, long timestamp, String help) {
        MetricSample sample = MetricSample.gauge(name, labels, value, timestamp).withHelp(help);
        return MetricEntry.of(sample, SELF, true, 0L);
    }
}
