package com.wangbin.exporter.common.exception;

import com.wangbin.exporter.common.domain.enums.ErrorCategory;
import lombok.Getter;

/**
 * 导出器异常，携带目标设备与路径上下文
 */
@Getter
public class ExporterException extends BusinessException {

    private final String targetName;
    private final String path;
    private final ErrorCategory category;

    public ExporterException(String message, String targetName, String path, ErrorCategory category) {
        super(category.getCode(), message);
        this.targetName = targetName;
        this.path = path;
        this.category = category;
    }

    public ExporterException(String message, String targetName, String path, ErrorCategory category, Throwable cause) {
        super(category.getCode(), message, cause);
        this.targetName = targetName;
        this.path = path;
        this.category = category;
    }

    // 配置异常（唯一会导致进程退出的错误）
    public static ExporterException configException(String message, String targetName) {
        return new ExporterException(message, targetName, null, ErrorCategory.CONFIG);
    }

    // 配置异常，带路径
    public static ExporterException configException(String message, String targetName, String path, Throwable cause) {
        return new ExporterException(message, targetName, path, ErrorCategory.CONFIG, cause);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (targetName != null) {
            sb.append(" [target=").append(targetName);
            if (path != null) {
                sb.append(", path=").append(path);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
