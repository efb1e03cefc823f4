package com.wangbin.exporter.core.plugin.openconfig;

import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.gnmi.util.TypedValues;
import com.wangbin.exporter.core.plugin.base.AbstractTelemetryPlugin;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.base.PluginOutput;
import com.wangbin.exporter.core.store.model.MetricSample;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 接口计数器速率插件：rate = (当前值 - 上次值) / 间隔秒数。
 * 计数器回退（设备重启或清零）时只重置基线，不产出样本。
 */
@Slf4j
public class InterfaceRatePlugin extends AbstractTelemetryPlugin {

    public static final String TYPE = "oc_interfaces_rate";

    private static final List<SchemaPath> PATHS = List.of(SchemaPath.parse("/interfaces/interface/state/counters"));

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    /**
     * 计数器路径（带接口名） -> 上一次的值
     */
    private final Map<SchemaPath, Baseline> baselines = new HashMap<>();

    public InterfaceRatePlugin(PluginContext context) {
        super(context);
    }

    @Override
    public Set<String> getDataModels() {
        return Set.of(OcInterfacesPlugin.DATA_MODEL);
    }

    @Override
    protected List<SchemaPath> defaultPaths() {
        return PATHS;
    }

    @Override
    protected String getOrigin() {
        return OcInterfacesPlugin.ORIGIN;
    }

    @Override
    protected PluginOutput doProcess(TelemetryUpdate update) {
        SchemaPath path = update.path();
        String counter = path.lastName();
        if (!OcInterfacesPlugin.IFACE_COUNTERS.contains(counter)) {
            return PluginOutput.empty();
        }
        String name = path.key(1, "name");
        if (name == null) {
            throw new IllegalArgumentException("计数器路径缺少接口名: " + path);
        }

        double value = TypedValues.toDouble(update.value());
        long timestamp = update.timestampNanos();
        Baseline previous = baselines.get(path);
        if (previous == null) {
            baselines.put(path, new Baseline(value, timestamp));
            return PluginOutput.empty();
        }

        long elapsed = timestamp - previous.timestampNanos();
        if (elapsed <= 0) {
            // 重复或乱序的采样，保留原基线
            return PluginOutput.empty();
        }
        baselines.put(path, new Baseline(value, timestamp));
        if (value < previous.value()) {
            log.debug("计数器回退，重置速率基线: target={}, path={}, previous={}, current={}",
                    context.getTargetName(), path, previous.value(), value);
            return PluginOutput.empty();
        }

        double rate = (value - previous.value()) / (elapsed / NANOS_PER_SECOND);
        Map<String, String> labels = baseLabels(OcInterfacesPlugin.DATA_MODEL);
        labels.put("name", name);
        MetricSample sample = MetricSample.gauge(metricName("iface", counter, "rate"), labels, rate,
                update.timestampMillis());
        track(sample.key(), path);
        return PluginOutput.of(sample);
    }

    @Override
    protected void doDelete(SchemaPath path) {
        Iterator<SchemaPath> iterator = baselines.keySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().startsWith(path)) {
                iterator.remove();
            }
        }
    }

    @Override
    protected void clearDerivedState() {
        baselines.clear();
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = super.getStatistics();
        stats.put("baselines", baselines.size());
        return stats;
    }

    private record Baseline(double value, long timestampNanos) {
    }
}
