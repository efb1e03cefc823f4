package com.wangbin.exporter.core.store.model;

/**
 * 目标级回收方式
 */
public enum EvictionMode {
    /** 保留条目但标记为失效（目标暂时不可达） */
    MARK_STALE,
    /** 直接删除（持续失败或关闭） */
    REMOVE
}
