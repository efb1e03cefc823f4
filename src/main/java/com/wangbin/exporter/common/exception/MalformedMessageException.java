package com.wangbin.exporter.common.exception;

import com.wangbin.exporter.common.domain.enums.ErrorCategory;

/**
 * 通知无法转换（路径或值不合法）
 */
public class MalformedMessageException extends ExporterException {

    public MalformedMessageException(String message, String targetName, String path) {
        super(message, targetName, path, ErrorCategory.PROTOCOL);
    }

    public MalformedMessageException(String message, String targetName, String path, Throwable cause) {
        super(message, targetName, path, ErrorCategory.PROTOCOL, cause);
    }
}
