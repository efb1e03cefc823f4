package com.wangbin.exporter.core.plugin.factory;

import com.wangbin.exporter.common.exception.ExporterException;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.base.TelemetryPlugin;
import com.wangbin.exporter.core.plugin.generic.GenericGaugePlugin;
import com.wangbin.exporter.core.plugin.openconfig.InterfaceRatePlugin;
import com.wangbin.exporter.core.plugin.openconfig.OcInterfacesPlugin;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 插件工厂，按类型创建插件实例，每个（目标, 插件类型）一个实例
 */
@Slf4j
@Component
public class PluginFactory {

    private final Map<String, PluginCreator> pluginCreators = new LinkedHashMap<>();

    public PluginFactory() {
        // 注册所有插件创建器
        registerPluginCreators();
    }

    /**
     * 创建插件
     */
    public TelemetryPlugin createPlugin(PluginContext context) {
        String type = context.getPluginType();
        if (type == null || type.isBlank()) {
            throw ExporterException.configException("插件类型不能为空", context.getTargetName());
        }

        PluginCreator creator = pluginCreators.get(type);
        if (creator == null) {
            throw ExporterException.configException(String.format("不支持的插件类型: %s", type),
                    context.getTargetName());
        }

        try {
            TelemetryPlugin plugin = creator.create(context);
            log.info("插件创建成功: {} [{}]", context.getTargetName(), type);
            return plugin;
        } catch (RuntimeException e) {
            log.error("插件创建失败: {} [{}]", context.getTargetName(), type, e);
            throw ExporterException.configException("插件创建失败: " + e.getMessage(),
                    context.getTargetName(), null, e);
        }
    }

    /**
     * 注册插件
     */
    public void registerPlugin(String type, PluginCreator creator) {
        pluginCreators.put(type, creator);
        log.info("注册插件: {}", type);
    }

    public boolean supports(String type) {
        return type != null && pluginCreators.containsKey(type);
    }

    public Set<String> getSupportedTypes() {
        return Collections.unmodifiableSet(pluginCreators.keySet());
    }

    private void registerPluginCreators() {
        registerPlugin(OcInterfacesPlugin.TYPE, OcInterfacesPlugin::new);
        registerPlugin(InterfaceRatePlugin.TYPE, InterfaceRatePlugin::new);
        registerPlugin(GenericGaugePlugin.TYPE, GenericGaugePlugin::new);
        log.info("插件工厂初始化完成，支持 {} 种插件", pluginCreators.size());
    }

    /**
     * 插件创建器接口
     */
    @FunctionalInterface
    public interface PluginCreator {
        TelemetryPlugin create(PluginContext context);
    }
}
