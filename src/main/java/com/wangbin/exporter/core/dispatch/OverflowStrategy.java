package com.wangbin.exporter.core.dispatch;

/**
 * 插件队列溢出策略
 */
public enum OverflowStrategy {
    /** 最多等待 offer-timeout，仍然满则丢弃并计数 */
    BLOCK,
    /** 丢弃新到的更新 */
    DROP_LATEST,
    /** 丢弃队列中最老的更新 */
    DROP_OLDEST;

    public static OverflowStrategy from(String text) {
        if (text == null || text.isBlank()) {
            return BLOCK;
        }
        try {
            return OverflowStrategy.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return BLOCK;
        }
    }
}
