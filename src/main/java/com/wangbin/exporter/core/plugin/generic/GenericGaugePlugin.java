package com.wangbin.exporter.core.plugin.generic;

import com.wangbin.exporter.common.utils.MetricNameUtil;
import com.wangbin.exporter.core.gnmi.model.PathElement;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.gnmi.util.TypedValues;
import com.wangbin.exporter.core.plugin.base.AbstractTelemetryPlugin;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.base.PluginOutput;
import com.wangbin.exporter.core.store.model.MetricSample;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 通用插件：订阅路径下每个数值（或布尔）叶子导出为一个 gauge。
 * 指标名由路径元素名拼接，列表键作为标签；非数值叶子作为插件错误抛出，由工作线程计数并记录。
 * <p>
 * 选项：{@code data-models} 逗号分隔的数据模型，{@code origin} 路径来源。
 */
public class GenericGaugePlugin extends AbstractTelemetryPlugin {

    public static final String TYPE = "generic";

    private final Set<String> dataModels = new LinkedHashSet<>();
    private final String origin;

    public GenericGaugePlugin(PluginContext context) {
        super(context);
        if (context.getPaths().isEmpty()) {
            throw new IllegalArgumentException("generic 插件必须配置 paths");
        }
        for (String model : context.option("data-models", "").split(",")) {
            if (!model.isBlank()) {
                dataModels.add(model.trim());
            }
        }
        this.origin = context.option("origin", "");
    }

    @Override
    public Set<String> getDataModels() {
        return dataModels;
    }

    @Override
    protected List<SchemaPath> defaultPaths() {
        return List.of();
    }

    @Override
    protected String getOrigin() {
        return origin;
    }

    @Override
    protected PluginOutput doProcess(TelemetryUpdate update) {
        SchemaPath path = update.path();
        if (!TypedValues.isNumeric(update.value())) {
            throw new IllegalArgumentException("叶子值不是数值: path=" + path + ", value=" + update.value());
        }
        double value = TypedValues.toDouble(update.value());

        String[] names = new String[path.size()];
        Map<String, String> labels = baseLabels(dataModels.isEmpty() ? null : String.join(",", dataModels));
        for (int i = 0; i < path.size(); i++) {
            PathElement element = path.get(i);
            names[i] = element.name();
            for (Map.Entry<String, String> key : element.keys().entrySet()) {
                String label = MetricNameUtil.sanitize(key.getKey());
                if (labels.containsKey(label)) {
                    label = MetricNameUtil.join(element.name(), key.getKey());
                }
                labels.put(label, key.getValue());
            }
        }

        MetricSample sample = MetricSample.gauge(metricName(names), labels, value, update.timestampMillis());
        track(sample.key(), path);
        return PluginOutput.of(sample);
    }
}
