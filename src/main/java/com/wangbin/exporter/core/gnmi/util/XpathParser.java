package com.wangbin.exporter.core.gnmi.util;

import com.wangbin.exporter.core.gnmi.model.PathElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将 xpath 字符串解析为路径元素列表。
 * 键值中允许出现 '/'，例如 /interfaces/interface[name=Ethernet1/1]/state
 */
public final class XpathParser {

    private XpathParser() {
    }

    public static List<PathElement> parse(String xpath) {
        if (xpath == null || xpath.isBlank()) {
            throw new IllegalArgumentException("xpath 不能为空");
        }
        String text = xpath.trim();
        if ("/".equals(text)) {
            throw new IllegalArgumentException("不支持订阅根路径");
        }

        List<PathElement> elements = new ArrayList<>();
        StringBuilder component = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth < 0) {
                    throw new IllegalArgumentException("xpath 方括号不匹配: " + xpath);
                }
            }
            if (c == '/' && depth == 0) {
                if (component.length() > 0) {
                    elements.add(parseComponent(component.toString(), xpath));
                    component.setLength(0);
                }
                continue;
            }
            component.append(c);
        }
        if (depth != 0) {
            throw new IllegalArgumentException("xpath 方括号不匹配: " + xpath);
        }
        if (component.length() > 0) {
            elements.add(parseComponent(component.toString(), xpath));
        }
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("xpath 不包含任何元素: " + xpath);
        }
        return elements;
    }

    private static PathElement parseComponent(String component, String xpath) {
        int bracket = component.indexOf('[');
        if (bracket < 0) {
            return PathElement.of(component);
        }
        String name = component.substring(0, bracket);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("xpath 元素缺少名称: " + xpath);
        }

        Map<String, String> keys = new LinkedHashMap<>();
        int pos = bracket;
        while (pos < component.length()) {
            if (component.charAt(pos) != '[') {
                throw new IllegalArgumentException("xpath 元素解析失败: " + component);
            }
            int close = findClose(component, pos);
            String body = component.substring(pos + 1, close);
            int eq = body.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("xpath 键格式错误: " + component);
            }
            keys.put(body.substring(0, eq).trim(), body.substring(eq + 1).trim());
            pos = close + 1;
        }
        return PathElement.of(name, keys);
    }

    private static int findClose(String component, int open) {
        int depth = 0;
        for (int i = open; i < component.length(); i++) {
            char c = component.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new IllegalArgumentException("xpath 方括号不匹配: " + component);
    }
}
