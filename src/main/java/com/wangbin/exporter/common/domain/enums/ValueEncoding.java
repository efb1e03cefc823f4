package com.wangbin.exporter.common.domain.enums;

import lombok.Getter;

import java.util.List;

/**
 * 叶子值编码枚举，number 与 gNMI Encoding 的取值一致
 */
@Getter
public enum ValueEncoding {

    JSON("JSON", 0),
    BYTES("BYTES", 1),
    PROTO("PROTO", 2),
    ASCII("ASCII", 3),
    JSON_IETF("JSON_IETF", 4);

    /**
     * 未强制指定编码时的选择顺序
     */
    public static final List<ValueEncoding> PREFERRED = List.of(PROTO, JSON, JSON_IETF, ASCII);

    private final String code;
    private final int number;

    ValueEncoding(String code, int number) {
        this.code = code;
        this.number = number;
    }

    public static ValueEncoding fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (ValueEncoding encoding : PREFERRED) {
            if (encoding.getCode().equalsIgnoreCase(code.trim())) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("不支持的编码: " + code);
    }
}
