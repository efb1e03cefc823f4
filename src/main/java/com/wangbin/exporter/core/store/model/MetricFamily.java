package com.wangbin.exporter.core.store.model;

import java.util.Set;
import java.util.TreeSet;

/**
 * 同名指标的描述：类型、说明、标签键集合。首次写入时确定。
 */
public record MetricFamily(String name, MetricType type, String help, Set<String> labelKeys) {

    public MetricFamily {
        labelKeys = Set.copyOf(new TreeSet<>(labelKeys));
    }

    public static MetricFamily of(MetricSample sample) {
        return new MetricFamily(sample.name(), sample.type(), sample.help(), sample.labels().keySet());
    }

    public boolean isCompatible(MetricSample sample) {
        return type == sample.type() && labelKeys.equals(sample.labels().keySet());
    }
}
