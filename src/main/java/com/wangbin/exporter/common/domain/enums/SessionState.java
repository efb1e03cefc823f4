package com.wangbin.exporter.common.domain.enums;

import lombok.Getter;

/**
 * 订阅会话状态枚举
 */
@Getter
public enum SessionState {

    IDLE("IDLE", "未启动"),
    CONNECTING("CONNECTING", "连接中"),
    SYNCING("SYNCING", "同步中"),
    STREAMING("STREAMING", "数据流中"),
    BACKOFF("BACKOFF", "退避等待"),
    FAILED("FAILED", "持续失败"),
    CLOSED("CLOSED", "已关闭");

    private final String code;
    private final String description;

    SessionState(String code, String description) {
        this.code = code;
        this.description = description;
    }

    // 根据code获取枚举
    public static SessionState fromCode(String code) {
        for (SessionState state : values()) {
            if (state.getCode().equals(code)) {
                return state;
            }
        }
        return IDLE;
    }

    // 是否处于不可达状态
    public boolean isUnreachable() {
        return this == BACKOFF || this == FAILED;
    }

    /**
     * 健康探针使用的粗粒度状态
     */
    public String healthState() {
        return switch (this) {
            case IDLE, CONNECTING, SYNCING -> "connecting";
            case STREAMING -> "streaming";
            case BACKOFF -> "backing-off";
            case FAILED -> "failed";
            case CLOSED -> "closed";
        };
    }
}
