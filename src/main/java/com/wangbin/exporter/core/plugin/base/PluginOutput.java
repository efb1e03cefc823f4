package com.wangbin.exporter.core.plugin.base;

import com.wangbin.exporter.core.store.model.MetricKey;
import com.wangbin.exporter.core.store.model.MetricSample;

import java.util.List;

/**
 * 插件一次处理的产出：新样本 + 需要撤回的指标标识
 */
public record PluginOutput(List<MetricSample> samples, List<MetricKey> retracted) {

    private static final PluginOutput EMPTY = new PluginOutput(List.of(), List.of());

    public PluginOutput {
        samples = samples == null ? List.of() : List.copyOf(samples);
        retracted = retracted == null ? List.of() : List.copyOf(retracted);
    }

    public static PluginOutput empty() {
        return EMPTY;
    }

    public static PluginOutput of(List<MetricSample> samples) {
        return new PluginOutput(samples, List.of());
    }

    public static PluginOutput of(MetricSample sample) {
        return new PluginOutput(List.of(sample), List.of());
    }

    public static PluginOutput retract(List<MetricKey> keys) {
        return new PluginOutput(List.of(), keys);
    }

    public boolean isEmpty() {
        return samples.isEmpty() && retracted.isEmpty();
    }
}
