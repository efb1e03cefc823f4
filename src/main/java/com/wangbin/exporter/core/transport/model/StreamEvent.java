package com.wangbin.exporter.core.transport.model;

import com.wangbin.exporter.core.gnmi.model.TelemetryNotification;

/**
 * 订阅流上的一个事件
 */
public record StreamEvent(Kind kind, TelemetryNotification notification, Throwable error, String detail) {

    public enum Kind {
        /** 数据通知 */
        NOTIFICATION,
        /** 初始同步完成 */
        SYNC_RESPONSE,
        /** 无法转换的消息，流保持打开 */
        MALFORMED,
        /** 流异常结束 */
        ERROR,
        /** 设备正常关闭流 */
        COMPLETED
    }

    public static StreamEvent notification(TelemetryNotification notification) {
        return new StreamEvent(Kind.NOTIFICATION, notification, null, null);
    }

    public static StreamEvent syncResponse() {
        return new StreamEvent(Kind.SYNC_RESPONSE, null, null, null);
    }

    public static StreamEvent malformed(String detail, Throwable cause) {
        return new StreamEvent(Kind.MALFORMED, null, cause, detail);
    }

    public static StreamEvent error(Throwable error) {
        return new StreamEvent(Kind.ERROR, null, error, error == null ? null : error.getMessage());
    }

    public static StreamEvent completed() {
        return new StreamEvent(Kind.COMPLETED, null, null, null);
    }

    public boolean isTerminal() {
        return kind == Kind.ERROR || kind == Kind.COMPLETED;
    }
}
