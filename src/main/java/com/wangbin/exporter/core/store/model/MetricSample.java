package com.wangbin.exporter.core.store.model;

import java.util.Map;
import java.util.Objects;

/**
 * 插件产出的单个指标样本
 */
public record MetricSample(MetricKey key, MetricType type, double value, long timestampMillis, String help) {

    public MetricSample {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        help = help == null ? "" : help;
    }

    public static MetricSample gauge(String name, Map<String, String> labels, double value, long timestampMillis) {
        return new MetricSample(MetricKey.of(name, labels), MetricType.GAUGE, value, timestampMillis, null);
    }

    public static MetricSample counter(String name, Map<String, String> labels, double value, long timestampMillis) {
        return new MetricSample(MetricKey.of(name, labels), MetricType.COUNTER, value, timestampMillis, null);
    }

    public MetricSample withHelp(String text) {
        return new MetricSample(key, type, value, timestampMillis, text);
    }

    public String name() {
        return key.name();
    }

    public Map<String, String> labels() {
        return key.labels();
    }
}
