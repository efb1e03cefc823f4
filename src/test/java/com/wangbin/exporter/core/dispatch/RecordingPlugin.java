package com.wangbin.exporter.core.dispatch;

import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.gnmi.util.TypedValues;
import com.wangbin.exporter.core.plugin.base.AbstractTelemetryPlugin;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.base.PluginOutput;
import com.wangbin.exporter.core.store.model.MetricSample;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 测试用插件：数值叶子输出为 gauge，非数值抛出异常，并记录收到的回调
 */
public class RecordingPlugin extends AbstractTelemetryPlugin {

    private final List<SchemaPath> defaults;
    public final List<TelemetryUpdate> updates = new CopyOnWriteArrayList<>();
    public final List<SchemaPath> deletes = new CopyOnWriteArrayList<>();
    public final List<Boolean> syncEvents = new CopyOnWriteArrayList<>();

    public RecordingPlugin(String targetName, String type, String... paths) {
        super(PluginContext.builder()
                .instanceName("test")
                .targetName(targetName)
                .metricPrefix("gnmi")
                .pluginType(type)
                .build());
        this.defaults = Arrays.stream(paths).map(SchemaPath::parse).toList();
    }

    @Override
    protected List<SchemaPath> defaultPaths() {
        return defaults;
    }

    @Override
    public Set<String> getDataModels() {
        return Set.of();
    }

    @Override
    protected PluginOutput doProcess(TelemetryUpdate update) {
        updates.add(update);
        if (!TypedValues.isNumeric(update.value())) {
            throw new IllegalArgumentException("非数值: " + update.value());
        }
        Map<String, String> labels = baseLabels(null);
        String name = metricName(getType(), update.path().lastName());
        MetricSample sample = MetricSample.gauge(name, labels, TypedValues.toDouble(update.value()),
                update.timestampMillis());
        track(sample.key(), update.path());
        return PluginOutput.of(sample);
    }

    @Override
    protected void doDelete(SchemaPath path) {
        deletes.add(path);
    }

    @Override
    public void onSyncStatusChanged(boolean synced) {
        syncEvents.add(synced);
        super.onSyncStatusChanged(synced);
    }
}
