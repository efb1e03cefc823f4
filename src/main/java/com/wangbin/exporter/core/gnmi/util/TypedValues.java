package com.wangbin.exporter.core.gnmi.util;

import java.math.BigDecimal;

/**
 * 叶子值类型转换工具
 */
public final class TypedValues {

    private TypedValues() {
    }

    /**
     * 转为数值。布尔值映射为 1/0，数字字符串（JSON_IETF 对 64 位整数的编码）会被解析。
     *
     * @throws IllegalArgumentException 值不是数值类型
     */
    public static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1d : 0d;
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim()).doubleValue();
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("非数值类型的叶子值: \"" + text + "\"");
            }
        }
        throw new IllegalArgumentException("不支持的叶子值类型: "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    public static boolean isNumeric(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return true;
        }
        if (value instanceof String text) {
            try {
                new BigDecimal(text.trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    public static String asString(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
