package com.wangbin.exporter.core.manager;

import com.wangbin.exporter.common.domain.enums.MatchMode;
import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.domain.enums.ValueEncoding;
import com.wangbin.exporter.common.exception.ExporterException;
import com.wangbin.exporter.core.config.ExporterProperties;
import com.wangbin.exporter.core.config.ExporterProperties.DeviceConfig;
import com.wangbin.exporter.core.config.ExporterProperties.PluginConfig;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.manager.model.PluginBinding;
import com.wangbin.exporter.core.manager.model.Target;
import com.wangbin.exporter.core.plugin.factory.PluginFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 将配置中的设备列表与设备模板合并为目标，并做启动期校验。
 * 校验失败抛出配置类 {@link ExporterException}，这是唯一会导致进程退出的错误。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TargetConfigResolver {

    static final int DEFAULT_PORT = 9339;

    private final PluginFactory pluginFactory;

    public List<Target> resolve(ExporterProperties properties) {
        validateGlobal(properties);
        Duration sampleInterval = properties.getScrapeInterval().dividedBy(properties.getOversampling());
        DeviceConfig template = properties.getDeviceTemplate() != null
                ? properties.getDeviceTemplate() : new DeviceConfig();

        List<Target> targets = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (DeviceConfig device : properties.getDevices()) {
            Target target = resolveDevice(device, template, sampleInterval);
            if (!names.add(target.getName())) {
                throw ExporterException.configException("设备名称重复", target.getName());
            }
            targets.add(target);
        }
        log.info("目标配置解析完成: targets={}, sampleInterval={}", targets.size(), sampleInterval);
        return targets;
    }

    private void validateGlobal(ExporterProperties properties) {
        if (properties.getScrapeInterval() == null || properties.getScrapeInterval().isZero()
                || properties.getScrapeInterval().isNegative()) {
            throw ExporterException.configException("scrape-interval 必须大于 0", null);
        }
        if (properties.getOversampling() < 1) {
            throw ExporterException.configException("oversampling 必须大于等于 1", null);
        }
        if (properties.getWatchdogMultiplier() < 1) {
            throw ExporterException.configException("watchdog-multiplier 必须大于等于 1", null);
        }
    }

    private Target resolveDevice(DeviceConfig device, DeviceConfig template, Duration sampleInterval) {
        String name = device.getName();
        if (name == null || name.isBlank()) {
            throw ExporterException.configException("设备名称不能为空", null);
        }
        String address = firstNonNull(device.getAddress(), template.getAddress());
        if (address == null || address.isBlank()) {
            throw ExporterException.configException("设备地址不能为空", name);
        }
        int port = firstNonNull(device.getPort(), template.getPort(), DEFAULT_PORT);
        if (port <= 0 || port > 65535) {
            throw ExporterException.configException("设备端口非法: " + port, name);
        }

        SubscribeMode mode;
        ValueEncoding encoding;
        try {
            mode = SubscribeMode.fromCode(firstNonNull(device.getMode(), template.getMode()));
            encoding = ValueEncoding.fromCode(firstNonNull(device.getForceEncoding(), template.getForceEncoding()));
        } catch (IllegalArgumentException e) {
            throw ExporterException.configException(e.getMessage(), name, null, e);
        }

        List<PluginConfig> plugins = device.getPlugins() != null ? device.getPlugins() : template.getPlugins();
        if (plugins == null || plugins.isEmpty()) {
            throw ExporterException.configException("设备未配置任何插件", name);
        }

        Target.TargetBuilder builder = Target.builder()
                .name(name.trim())
                .address(address.trim())
                .port(port)
                .tls(Boolean.TRUE.equals(firstNonNull(device.getTls(), template.getTls())))
                .mode(mode)
                .forceEncoding(encoding)
                .sampleInterval(sampleInterval);

        Set<String> types = new HashSet<>();
        for (PluginConfig plugin : plugins) {
            PluginBinding binding = resolvePlugin(name, plugin);
            if (!types.add(binding.getType())) {
                throw ExporterException.configException("插件重复绑定: " + binding.getType(), name);
            }
            builder.plugin(binding);
        }
        return builder.build();
    }

    private PluginBinding resolvePlugin(String targetName, PluginConfig plugin) {
        String type = plugin.getType() == null ? null : plugin.getType().trim();
        if (!pluginFactory.supports(type)) {
            throw ExporterException.configException(String.format("不支持的插件类型: %s，可选: %s",
                    type, pluginFactory.getSupportedTypes()), targetName);
        }

        PluginBinding.PluginBindingBuilder builder = PluginBinding.builder().type(type);
        try {
            builder.match(MatchMode.from(plugin.getMatch()));
        } catch (IllegalArgumentException e) {
            throw ExporterException.configException(e.getMessage(), targetName, null, e);
        }
        if (plugin.getPaths() != null) {
            for (String xpath : plugin.getPaths()) {
                try {
                    builder.path(SchemaPath.parse(xpath));
                } catch (IllegalArgumentException e) {
                    throw ExporterException.configException("路径格式错误: " + e.getMessage(), targetName, xpath, e);
                }
            }
        }
        if (plugin.getOptions() != null) {
            builder.options(plugin.getOptions());
        }
        return builder.build();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
