package com.wangbin.exporter.monitor.health;

import lombok.Builder;
import lombok.Data;

/**
 * 单个目标的健康视图，供存活/就绪探针使用
 */
@Data
@Builder
public class TargetHealth {

    private final String targetName;
    private final String endpoint;

    /**
     * 会话状态枚举值
     */
    private final String state;

    /**
     * connecting / streaming / backing-off / failed / closed
     */
    private final String healthState;

    private final boolean synced;
    private final long lastSuccessTime;
    private final long stateChangedTime;
    private final int retries;
    private final long nextRetryDelay;
    private final String lastError;
    private final long lastErrorTime;
    private final long notificationsReceived;
    private final long malformedMessages;
    private final long pluginErrors;
}
