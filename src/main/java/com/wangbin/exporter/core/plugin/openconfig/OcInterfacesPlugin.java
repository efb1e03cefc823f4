package com.wangbin.exporter.core.plugin.openconfig;

import com.wangbin.exporter.core.gnmi.model.PathElement;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.gnmi.util.TypedValues;
import com.wangbin.exporter.core.plugin.base.AbstractTelemetryPlugin;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.base.PluginOutput;
import com.wangbin.exporter.core.store.model.MetricKey;
import com.wangbin.exporter.core.store.model.MetricSample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * openconfig-interfaces 插件。
 * <p>
 * 接口与子接口的计数器导出为 counter，last-change / last-clear 导出为 gauge；
 * oper-status 导出为 {@code _oper_up}；mtu、description、ifindex、admin/oper-status
 * 作为标签挂在 {@code _info} 指标上，属性变化时旧的 info 序列会被撤回。
 */
@Slf4j
public class OcInterfacesPlugin extends AbstractTelemetryPlugin {

    public static final String TYPE = "oc_interfaces";
    public static final String DATA_MODEL = "openconfig-interfaces";
    public static final String ORIGIN = "openconfig";

    static final Set<String> SUBIFACE_COUNTERS = Set.of(
            "in-octets", "in-pkts", "in-unicast-pkts", "in-broadcast-pkts", "in-multicast-pkts",
            "in-errors", "in-discards", "in-unknown-protos", "in-fcs-errors",
            "out-octets", "out-pkts", "out-unicast-pkts", "out-broadcast-pkts", "out-multicast-pkts",
            "out-errors", "out-discards", "carrier-transitions");

    static final Set<String> IFACE_COUNTERS;

    static {
        Set<String> counters = new HashSet<>(SUBIFACE_COUNTERS);
        counters.add("resets");
        IFACE_COUNTERS = Set.copyOf(counters);
    }

    static final Set<String> TIME_GAUGES = Set.of("last-change", "last-clear");

    static final List<String> INFO_ATTRIBUTES = List.of("mtu", "description", "ifindex", "admin-status", "oper-status");

    private static final List<SchemaPath> PATHS = List.of(
            SchemaPath.parse("/interfaces/interface/state"),
            SchemaPath.parse("/interfaces/interface/subinterfaces/subinterface/state"));

    /**
     * 接口（或子接口）状态路径 -> 属性
     */
    private final Map<SchemaPath, Map<String, String>> attributes = new HashMap<>();

    /**
     * 接口（或子接口）状态路径 -> 当前 info 序列
     */
    private final Map<SchemaPath, MetricKey> infoKeys = new HashMap<>();

    public OcInterfacesPlugin(PluginContext context) {
        super(context);
    }

    @Override
    public Set<String> getDataModels() {
        return Set.of(DATA_MODEL);
    }

    @Override
    protected List<SchemaPath> defaultPaths() {
        return PATHS;
    }

    @Override
    protected String getOrigin() {
        return ORIGIN;
    }

    @Override
    protected PluginOutput doProcess(TelemetryUpdate update) {
        InterfaceRef ref = InterfaceRef.resolve(update.path());
        if (ref == null) {
            log.debug("忽略非接口状态路径: target={}, path={}", context.getTargetName(), update.path());
            return PluginOutput.empty();
        }

        String leaf = update.path().lastName();
        long timestamp = update.timestampMillis();
        Set<String> counters = ref.subinterface() ? SUBIFACE_COUNTERS : IFACE_COUNTERS;

        if (counters.contains(leaf)) {
            MetricSample sample = MetricSample.counter(metricName(ref.family(), leaf), labels(ref),
                    TypedValues.toDouble(update.value()), timestamp);
            track(sample.key(), update.path());
            return PluginOutput.of(sample);
        }
        if (TIME_GAUGES.contains(leaf)) {
            MetricSample sample = MetricSample.gauge(metricName(ref.family(), leaf), labels(ref),
                    TypedValues.toDouble(update.value()), timestamp);
            track(sample.key(), update.path());
            return PluginOutput.of(sample);
        }
        if (INFO_ATTRIBUTES.contains(leaf)) {
            return updateAttribute(ref, leaf, TypedValues.asString(update.value()), timestamp);
        }
        return PluginOutput.empty();
    }

    private PluginOutput updateAttribute(InterfaceRef ref, String leaf, String value, long timestamp) {
        Map<String, String> attrs = attributes.computeIfAbsent(ref.statePath(), key -> new HashMap<>());
        attrs.put(leaf, value);

        List<MetricSample> samples = new ArrayList<>(2);
        List<MetricKey> retracted = new ArrayList<>(1);

        if ("oper-status".equals(leaf)) {
            MetricSample operUp = MetricSample.gauge(metricName(ref.family(), "oper_up"), labels(ref),
                    "UP".equalsIgnoreCase(value) ? 1d : 0d, timestamp);
            track(operUp.key(), ref.statePath());
            samples.add(operUp);
        }

        Map<String, String> infoLabels = labels(ref);
        for (String attribute : INFO_ATTRIBUTES) {
            infoLabels.put(attribute.replace('-', '_'), attrs.getOrDefault(attribute, ""));
        }
        MetricSample info = MetricSample.gauge(metricName(ref.family(), "info"), infoLabels, 1d, timestamp);
        MetricKey previous = infoKeys.put(ref.statePath(), info.key());
        if (previous != null && !previous.equals(info.key())) {
            untrack(previous);
            retracted.add(previous);
        }
        track(info.key(), ref.statePath());
        samples.add(info);
        return new PluginOutput(samples, retracted);
    }

    private Map<String, String> labels(InterfaceRef ref) {
        Map<String, String> labels = baseLabels(DATA_MODEL);
        labels.put("name", ref.name());
        if (ref.subinterface()) {
            labels.put("index", ref.index());
        }
        return labels;
    }

    @Override
    protected void doDelete(SchemaPath path) {
        removeUnder(attributes, path);
        removeUnder(infoKeys, path);
    }

    @Override
    protected void clearDerivedState() {
        attributes.clear();
        infoKeys.clear();
    }

    @Override
    protected void onTrackingExpired(Set<MetricKey> keys) {
        Iterator<Map.Entry<SchemaPath, MetricKey>> iterator = infoKeys.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<SchemaPath, MetricKey> entry = iterator.next();
            if (keys.contains(entry.getValue())) {
                attributes.remove(entry.getKey());
                iterator.remove();
            }
        }
    }

    int infoKeyCount() {
        return infoKeys.size();
    }

    private static void removeUnder(Map<SchemaPath, ?> map, SchemaPath path) {
        Iterator<SchemaPath> iterator = map.keySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().startsWith(path)) {
                iterator.remove();
            }
        }
    }

    /**
     * 从更新路径中识别接口或子接口
     *
     * @param statePath 接口（子接口）的 state 容器路径，带列表键
     */
    record InterfaceRef(String name, String index, SchemaPath statePath) {

        static InterfaceRef resolve(SchemaPath path) {
            if (path.size() < 4 || !"interfaces".equals(path.get(0).name())
                    || !"interface".equals(path.get(1).name())) {
                return null;
            }
            String name = requireKey(path, 1, "name");
            if ("state".equals(path.get(2).name())) {
                return new InterfaceRef(name, null, path.subPathTo(3));
            }
            if (path.size() >= 6 && "subinterfaces".equals(path.get(2).name())
                    && "subinterface".equals(path.get(3).name()) && "state".equals(path.get(4).name())) {
                return new InterfaceRef(name, requireKey(path, 3, "index"), path.subPathTo(5));
            }
            return null;
        }

        private static String requireKey(SchemaPath path, int index, String keyName) {
            String value = path.key(index, keyName);
            if (value == null) {
                PathElement element = path.get(index);
                throw new IllegalArgumentException("路径元素 " + element + " 缺少列表键 " + keyName);
            }
            return value;
        }

        boolean subinterface() {
            return index != null;
        }

        String family() {
            return subinterface() ? "subiface" : "iface";
        }
    }
}
