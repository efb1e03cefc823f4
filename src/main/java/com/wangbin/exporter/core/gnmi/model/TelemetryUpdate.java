package com.wangbin.exporter.core.gnmi.model;

import java.util.Objects;

/**
 * 单个叶子更新：完整路径 + 已解码的值 + 时间戳（纳秒）
 */
public record TelemetryUpdate(SchemaPath path, Object value, long timestampNanos) {

    public TelemetryUpdate {
        Objects.requireNonNull(path, "path");
    }

    public long timestampMillis() {
        return timestampNanos / 1_000_000L;
    }
}
