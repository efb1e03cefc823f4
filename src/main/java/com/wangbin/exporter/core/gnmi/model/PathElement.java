package com.wangbin.exporter.core.gnmi.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 路径元素：名称 + 列表键
 */
public record PathElement(String name, Map<String, String> keys) {

    public static final String WILDCARD = "*";

    public PathElement {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("路径元素名称不能为空");
        }
        keys = (keys == null || keys.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(keys));
    }

    public static PathElement of(String name) {
        return new PathElement(name, null);
    }

    public static PathElement of(String name, Map<String, String> keys) {
        return new PathElement(name, keys);
    }

    public boolean isWildcard() {
        return WILDCARD.equals(name);
    }

    public boolean hasKeys() {
        return !keys.isEmpty();
    }

    public String key(String keyName) {
        return keys.get(keyName);
    }

    /**
     * 作为前缀元素时的匹配：名称相同，且本元素声明的键在对方元素中取值一致。
     * 未声明键的前缀元素匹配任意列表项，名称为 {@code *} 的前缀元素匹配任意名称。
     */
    public boolean matches(PathElement other) {
        if (!isWildcard() && !name.equals(other.name)) {
            return false;
        }
        for (Map.Entry<String, String> entry : keys.entrySet()) {
            String value = other.keys.get(entry.getKey());
            if (!"*".equals(entry.getValue()) && !entry.getValue().equals(value)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        if (keys.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name);
        keys.forEach((k, v) -> sb.append('[').append(k).append('=').append(v).append(']'));
        return sb.toString();
    }
}
