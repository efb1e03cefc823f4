package com.wangbin.exporter.common.domain.enums;

import lombok.Getter;

/**
 * 错误分类
 */
@Getter
public enum ErrorCategory {

    CONFIG(400, "配置错误", false),
    TRANSPORT(502, "传输错误", true),
    PROTOCOL(422, "协议错误", true),
    PLUGIN(500, "插件错误", true),
    STORE(409, "存储错误", true);

    private final int code;
    private final String description;
    private final boolean retryable;

    ErrorCategory(int code, String description, boolean retryable) {
        this.code = code;
        this.description = description;
        this.retryable = retryable;
    }
}
