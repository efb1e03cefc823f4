package com.wangbin.exporter.common.utils;

/**
 * 指标名与标签名规范化工具
 */
public final class MetricNameUtil {

    private MetricNameUtil() {
    }

    /**
     * 转为合法的指标名或标签名：'-' 等非法字符替换为 '_'，数字开头时补 '_'
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'
                    || (c >= '0' && c <= '9');
            sb.append(valid ? c : '_');
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /**
     * 用 '_' 拼接多个片段并规范化
     */
    public static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('_');
            }
            sb.append(part);
        }
        return sanitize(sb.toString());
    }
}
