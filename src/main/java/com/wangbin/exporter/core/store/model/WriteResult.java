package com.wangbin.exporter.core.store.model;

/**
 * 写入结果
 */
public enum WriteResult {
    /** 已写入 */
    ACCEPTED,
    /** 时间戳早于已存条目，拒绝 */
    OUT_OF_ORDER,
    /** 同名指标的标签键或类型不一致，拒绝 */
    LABEL_CONFLICT,
    /** 标识被另一个在线目标占用，拒绝 */
    OWNER_CONFLICT;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
