package com.wangbin.exporter.core.store.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 指标标识：指标名 + 标签集合（键唯一、与顺序无关）
 */
public record MetricKey(String name, Map<String, String> labels) implements Comparable<MetricKey> {

    private static final Comparator<MetricKey> ORDER = Comparator
            .comparing(MetricKey::name)
            .thenComparing(MetricKey::labels, MetricKey::compareLabels);

    public MetricKey {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("指标名不能为空");
        }
        if (labels == null || labels.isEmpty()) {
            labels = Collections.emptySortedMap();
        } else {
            TreeMap<String, String> sorted = new TreeMap<>();
            // 空值标签等同于空串
            labels.forEach((k, v) -> sorted.put(k, v == null ? "" : v));
            labels = Collections.unmodifiableSortedMap(sorted);
        }
    }

    public static MetricKey of(String name, Map<String, String> labels) {
        return new MetricKey(name, labels);
    }

    public String label(String key) {
        return labels.get(key);
    }

    @Override
    public int compareTo(MetricKey other) {
        return ORDER.compare(this, other);
    }

    /**
     * 标签按键排序后逐对比较键、值，前缀相同时条目少的在前
     */
    private static int compareLabels(Map<String, String> a, Map<String, String> b) {
        Iterator<Map.Entry<String, String>> left = a.entrySet().iterator();
        Iterator<Map.Entry<String, String>> right = b.entrySet().iterator();
        while (left.hasNext() && right.hasNext()) {
            Map.Entry<String, String> l = left.next();
            Map.Entry<String, String> r = right.next();
            int result = l.getKey().compareTo(r.getKey());
            if (result != 0) {
                return result;
            }
            result = l.getValue().compareTo(r.getValue());
            if (result != 0) {
                return result;
            }
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    }

    @Override
    public String toString() {
        return name + labels;
    }
}
