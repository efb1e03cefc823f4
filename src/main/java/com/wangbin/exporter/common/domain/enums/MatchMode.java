package com.wangbin.exporter.common.domain.enums;

/**
 * 插件路径匹配粒度
 */
public enum MatchMode {
    /** 通知路径以插件路径为前缀 */
    PREFIX,
    /** 通知路径与插件路径逐元素相同 */
    EXACT;

    public static MatchMode from(String text) {
        if (text == null || text.isBlank()) {
            return PREFIX;
        }
        try {
            return MatchMode.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("未知的匹配模式: " + text);
        }
    }
}
