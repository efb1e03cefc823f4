package com.wangbin.exporter.core.gnmi.model;

import java.util.List;

/**
 * 设备推送的一条通知，不可变
 */
public record TelemetryNotification(long timestampNanos,
                                    List<TelemetryUpdate> updates,
                                    List<SchemaPath> deletes,
                                    boolean atomic) {

    public TelemetryNotification {
        updates = updates == null ? List.of() : List.copyOf(updates);
        deletes = deletes == null ? List.of() : List.copyOf(deletes);
    }

    public boolean isEmpty() {
        return updates.isEmpty() && deletes.isEmpty();
    }
}
