package com.wangbin.exporter.monitor.metrics;

import com.wangbin.exporter.core.store.model.MetricEntry;

import java.util.List;
import java.util.Map;

/**
 * Prometheus 文本格式（0.0.4）输出。输入需按指标名排序，同名条目连续出现。
 */
public class PrometheusTextWriter {

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final boolean includeTimestamps;

    public PrometheusTextWriter(boolean includeTimestamps) {
        this.includeTimestamps = includeTimestamps;
    }

    public String write(List<MetricEntry> entries) {
        StringBuilder sb = new StringBuilder(entries.size() * 96);
        String currentName = null;
        for (MetricEntry entry : entries) {
            if (!entry.name().equals(currentName)) {
                currentName = entry.name();
                writeHeader(sb, entry);
            }
            writeSample(sb, entry);
        }
        return sb.toString();
    }

    private void writeHeader(StringBuilder sb, MetricEntry entry) {
        if (entry.help() != null && !entry.help().isEmpty()) {
            sb.append("# HELP ").append(entry.name()).append(' ').append(escapeHelp(entry.help())).append('\n');
        }
        sb.append("# TYPE ").append(entry.name()).append(' ').append(entry.type().exposition()).append('\n');
    }

    private void writeSample(StringBuilder sb, MetricEntry entry) {
        sb.append(entry.name());
        Map<String, String> labels = entry.labels();
        if (!labels.isEmpty()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> label : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(label.getKey()).append("=\"").append(escapeLabelValue(label.getValue())).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(formatValue(entry.value()));
        if (includeTimestamps && entry.timestampMillis() > 0) {
            sb.append(' ').append(entry.timestampMillis());
        }
        sb.append('\n');
    }

    static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String escapeLabelValue(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeHelp(String help) {
        return help.replace("\\", "\\\\").replace("\n", "\\n");
    }
}
