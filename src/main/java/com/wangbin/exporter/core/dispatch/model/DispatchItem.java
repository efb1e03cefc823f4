package com.wangbin.exporter.core.dispatch.model;

import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;

/**
 * 插件队列中的一项。
 * <p>
 * 每项都带有入队时的流代次（epoch，每次重连加一）和同步状态，
 * 工作线程据此按流顺序向插件通知同步状态变化，即使控制项被丢弃也不会错序。
 */
public record DispatchItem(Kind kind, TelemetryUpdate update, SchemaPath path, long epoch, boolean synced) {

    public enum Kind {
        UPDATE,
        DELETE,
        /** 同步状态变化（同步完成或流断开） */
        SYNC
    }

    public static DispatchItem update(TelemetryUpdate update, long epoch, boolean synced) {
        return new DispatchItem(Kind.UPDATE, update, update.path(), epoch, synced);
    }

    public static DispatchItem delete(SchemaPath path, long epoch, boolean synced) {
        return new DispatchItem(Kind.DELETE, null, path, epoch, synced);
    }

    public static DispatchItem sync(long epoch, boolean synced) {
        return new DispatchItem(Kind.SYNC, null, null, epoch, synced);
    }
}
