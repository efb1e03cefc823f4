package com.wangbin.exporter.core.manager;

import com.wangbin.exporter.common.domain.enums.ErrorCategory;
import com.wangbin.exporter.common.domain.enums.MatchMode;
import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.domain.enums.ValueEncoding;
import com.wangbin.exporter.common.exception.ExporterException;
import com.wangbin.exporter.core.config.ExporterProperties;
import com.wangbin.exporter.core.config.ExporterProperties.DeviceConfig;
import com.wangbin.exporter.core.config.ExporterProperties.PluginConfig;
import com.wangbin.exporter.core.manager.model.Target;
import com.wangbin.exporter.core.plugin.factory.PluginFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetConfigResolverTest {

    private final TargetConfigResolver resolver = new TargetConfigResolver(new PluginFactory());
    private ExporterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ExporterProperties();
        DeviceConfig template = new DeviceConfig();
        template.setPlugins(List.of(plugin("oc_interfaces")));
        properties.setDeviceTemplate(template);
    }

    @Test
    void devicesInheritTemplate() {
        properties.setDevices(List.of(device("spine-1", "10.0.0.1")));

        List<Target> targets = resolver.resolve(properties);

        Target target = targets.get(0);
        assertEquals("spine-1", target.getName());
        assertEquals(TargetConfigResolver.DEFAULT_PORT, target.getPort());
        assertEquals(SubscribeMode.SAMPLE, target.getMode());
        assertNull(target.getForceEncoding());
        assertFalse(target.isTls());
        assertEquals(Duration.ofSeconds(30), target.getSampleInterval());
        assertEquals("oc_interfaces", target.getPlugins().get(0).getType());
    }

    @Test
    void deviceSettingsOverrideTemplate() {
        DeviceConfig device = device("leaf-1", "10.0.0.2");
        device.setPort(57400);
        device.setMode("on_change");
        device.setForceEncoding("json_ietf");
        device.setTls(true);
        PluginConfig generic = plugin("generic");
        generic.setPaths(List.of("/system/state"));
        generic.setMatch("exact");
        device.setPlugins(List.of(generic));
        properties.setDevices(List.of(device));

        Target target = resolver.resolve(properties).get(0);

        assertEquals(57400, target.getPort());
        assertEquals(SubscribeMode.ON_CHANGE, target.getMode());
        assertEquals(ValueEncoding.JSON_IETF, target.getForceEncoding());
        assertTrue(target.isTls());
        assertEquals(MatchMode.EXACT, target.getPlugins().get(0).getMatch());
        assertEquals("/system/state", target.getPlugins().get(0).getPaths().get(0).toString());
    }

    @Test
    void duplicateDeviceNameIsRejected() {
        properties.setDevices(List.of(device("spine-1", "10.0.0.1"), device("spine-1", "10.0.0.9")));

        assertConfigError(() -> resolver.resolve(properties));
    }

    @Test
    void invalidSettingsAreRejected() {
        DeviceConfig noAddress = device("spine-1", null);
        properties.setDevices(List.of(noAddress));
        assertConfigError(() -> resolver.resolve(properties));

        DeviceConfig badPort = device("spine-1", "10.0.0.1");
        badPort.setPort(70000);
        properties.setDevices(List.of(badPort));
        assertConfigError(() -> resolver.resolve(properties));

        DeviceConfig badMode = device("spine-1", "10.0.0.1");
        badMode.setMode("POLL");
        properties.setDevices(List.of(badMode));
        assertConfigError(() -> resolver.resolve(properties));

        DeviceConfig unknownPlugin = device("spine-1", "10.0.0.1");
        unknownPlugin.setPlugins(List.of(plugin("bgp")));
        properties.setDevices(List.of(unknownPlugin));
        assertConfigError(() -> resolver.resolve(properties));

        DeviceConfig badPath = device("spine-1", "10.0.0.1");
        PluginConfig generic = plugin("generic");
        generic.setPaths(List.of("/interfaces/interface[name=eth0"));
        badPath.setPlugins(List.of(generic));
        properties.setDevices(List.of(badPath));
        assertConfigError(() -> resolver.resolve(properties));

        DeviceConfig twice = device("spine-1", "10.0.0.1");
        twice.setPlugins(List.of(plugin("oc_interfaces"), plugin("oc_interfaces")));
        properties.setDevices(List.of(twice));
        assertConfigError(() -> resolver.resolve(properties));
    }

    @Test
    void emptyPluginListIsRejected() {
        DeviceConfig device = device("spine-1", "10.0.0.1");
        device.setPlugins(List.of());
        properties.setDevices(List.of(device));

        assertConfigError(() -> resolver.resolve(properties));
    }

    @Test
    void invalidGlobalsAreRejected() {
        properties.setOversampling(0);

        assertConfigError(() -> resolver.resolve(properties));
    }

    private static void assertConfigError(org.junit.jupiter.api.function.Executable executable) {
        ExporterException e = assertThrows(ExporterException.class, executable);
        assertEquals(ErrorCategory.CONFIG, e.getCategory());
    }

    private static DeviceConfig device(String name, String address) {
        DeviceConfig device = new DeviceConfig();
        device.setName(name);
        device.setAddress(address);
        return device;
    }

    private static PluginConfig plugin(String type) {
        PluginConfig plugin = new PluginConfig();
        plugin.setType(type);
        return plugin;
    }
}
