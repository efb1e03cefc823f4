package com.wangbin.exporter.core.store.model;

/**
 * 指标类型
 */
public enum MetricType {
    COUNTER("counter"),
    GAUGE("gauge");

    private final String exposition;

    MetricType(String exposition) {
        this.exposition = exposition;
    }

    public String exposition() {
        return exposition;
    }
}
