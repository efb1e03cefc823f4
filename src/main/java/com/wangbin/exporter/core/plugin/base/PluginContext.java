package com.wangbin.exporter.core.plugin.base;

import com.wangbin.exporter.common.domain.enums.MatchMode;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 插件构造参数，每个（目标, 插件类型）一份
 */
@Getter
@Builder
public class PluginContext {

    private final String instanceName;
    private final String targetName;
    private final String metricPrefix;
    private final String pluginType;

    /**
     * 配置覆盖的订阅路径，为空时使用插件自身声明的路径
     */
    @Singular
    private final List<SchemaPath> paths;

    @Builder.Default
    private final MatchMode matchMode = MatchMode.PREFIX;

    @Singular
    private final Map<String, String> options;

    /**
     * 已产出序列的跟踪时长，超过该时长未再产出的序列不再跟踪（与缓存失效阈值一致）。
     * 为 null 时一直跟踪到删除通知或流断开
     */
    private final Duration trackingTtl;

    public String option(String key, String defaultValue) {
        String value = options.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public boolean booleanOption(String key, boolean defaultValue) {
        String value = options.get(key);
        return value == null || value.isBlank() ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
