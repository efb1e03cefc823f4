package com.wangbin.exporter.core.gnmi.model;

import com.wangbin.exporter.core.gnmi.util.XpathParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 模式路径（gNMI Path 的不可变表示）
 */
public final class SchemaPath {

    public static final SchemaPath ROOT = new SchemaPath(Collections.emptyList());

    private final List<PathElement> elements;
    private final int hash;

    private SchemaPath(List<PathElement> elements) {
        this.elements = elements;
        this.hash = elements.hashCode();
    }

    public static SchemaPath of(List<PathElement> elements) {
        if (elements == null || elements.isEmpty()) {
            return ROOT;
        }
        return new SchemaPath(List.copyOf(elements));
    }

    public static SchemaPath of(PathElement... elements) {
        return of(List.of(elements));
    }

    /**
     * 解析 xpath 形式的路径，例如 /interfaces/interface[name=eth0]/state
     */
    public static SchemaPath parse(String xpath) {
        return of(XpathParser.parse(xpath));
    }

    public List<PathElement> elements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isRoot() {
        return elements.isEmpty();
    }

    public PathElement get(int index) {
        return elements.get(index);
    }

    public String lastName() {
        return elements.isEmpty() ? "" : elements.get(elements.size() - 1).name();
    }

    /**
     * 获取指定层级的键值，不存在时返回 null
     */
    public String key(int index, String keyName) {
        if (index < 0 || index >= elements.size()) {
            return null;
        }
        return elements.get(index).key(keyName);
    }

    public SchemaPath append(PathElement element) {
        List<PathElement> list = new ArrayList<>(elements.size() + 1);
        list.addAll(elements);
        list.add(element);
        return new SchemaPath(Collections.unmodifiableList(list));
    }

    public SchemaPath concat(SchemaPath suffix) {
        if (suffix == null || suffix.isRoot()) {
            return this;
        }
        if (isRoot()) {
            return suffix;
        }
        List<PathElement> list = new ArrayList<>(elements.size() + suffix.size());
        list.addAll(elements);
        list.addAll(suffix.elements);
        return new SchemaPath(Collections.unmodifiableList(list));
    }

    /**
     * 前 toIndex 个元素组成的路径
     */
    public SchemaPath subPathTo(int toIndex) {
        return of(elements.subList(0, Math.min(toIndex, elements.size())));
    }

    /**
     * 本路径是否以 prefix 开头（逐元素按 {@link PathElement#matches} 比较）
     */
    public boolean startsWith(SchemaPath prefix) {
        if (prefix.size() > elements.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!prefix.get(i).matches(elements.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 与 prefix 长度相同且逐元素匹配
     */
    public boolean matchesExactly(SchemaPath prefix) {
        return prefix.size() == elements.size() && startsWith(prefix);
    }

    /**
     * 两条路径在公共长度内逐元素兼容（名称相同，共有的键取值一致）。
     * 用于删除通知的路由：删除的可能是插件前缀的上级节点。
     */
    public boolean overlaps(SchemaPath other) {
        int common = Math.min(elements.size(), other.size());
        for (int i = 0; i < common; i++) {
            PathElement mine = elements.get(i);
            PathElement theirs = other.get(i);
            if (!mine.isWildcard() && !theirs.isWildcard() && !mine.name().equals(theirs.name())) {
                return false;
            }
            for (Map.Entry<String, String> entry : mine.keys().entrySet()) {
                String value = theirs.key(entry.getKey());
                if (value != null && !"*".equals(value) && !"*".equals(entry.getValue())
                        && !value.equals(entry.getValue())) {
                    return false;
                }
            }
        }
        return true;
    }

    public SchemaPath withoutKeys() {
        List<PathElement> list = new ArrayList<>(elements.size());
        for (PathElement element : elements) {
            list.add(element.hasKeys() ? PathElement.of(element.name()) : element);
        }
        return of(list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaPath other)) {
            return false;
        }
        return hash == other.hash && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (elements.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (PathElement element : elements) {
            sb.append('/').append(element);
        }
        return sb.toString();
    }
}
