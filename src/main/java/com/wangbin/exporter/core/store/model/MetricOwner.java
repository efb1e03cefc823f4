package com.wangbin.exporter.core.store.model;

import java.util.Objects;

/**
 * 指标条目的归属：目标设备 + 插件类型
 */
public record MetricOwner(String targetName, String pluginType) {

    public MetricOwner {
        Objects.requireNonNull(targetName, "targetName");
        Objects.requireNonNull(pluginType, "pluginType");
    }

    @Override
    public String toString() {
        return targetName + "/" + pluginType;
    }
}
