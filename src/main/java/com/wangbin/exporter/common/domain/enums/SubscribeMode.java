package com.wangbin.exporter.common.domain.enums;

import lombok.Getter;

/**
 * 订阅模式枚举
 */
@Getter
public enum SubscribeMode {

    SAMPLE("SAMPLE", "周期采样"),
    ON_CHANGE("ON_CHANGE", "变化上报");

    private final String code;
    private final String description;

    SubscribeMode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    // 根据code获取枚举，未配置时按周期采样
    public static SubscribeMode fromCode(String code) {
        if (code == null || code.isBlank()) {
            return SAMPLE;
        }
        for (SubscribeMode mode : values()) {
            if (mode.getCode().equalsIgnoreCase(code.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("未知的订阅模式: " + code);
    }
}
