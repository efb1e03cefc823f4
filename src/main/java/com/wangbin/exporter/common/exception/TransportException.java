package com.wangbin.exporter.common.exception;

import com.wangbin.exporter.common.domain.enums.ErrorCategory;
import lombok.Getter;

/**
 * 传输层异常（拨号、能力查询、订阅失败），总是可重试
 */
@Getter
public class TransportException extends Exception {

    private final String targetName;
    private final ErrorCategory category = ErrorCategory.TRANSPORT;

    public TransportException(String message, String targetName) {
        super(message);
        this.targetName = targetName;
    }

    public TransportException(String message, String targetName, Throwable cause) {
        super(message, cause);
        this.targetName = targetName;
    }
}
