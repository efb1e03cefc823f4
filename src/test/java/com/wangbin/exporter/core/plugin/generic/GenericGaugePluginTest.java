package com.wangbin.exporter.core.plugin.generic;

import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.base.PluginOutput;
import com.wangbin.exporter.core.store.model.MetricSample;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GenericGaugePluginTest {

    @Test
    void leafBecomesGaugeNamedAfterPath() {
        GenericGaugePlugin plugin = plugin(PluginContext.builder()
                .path(SchemaPath.parse("/components/component/state"))
                .option("data-models", "openconfig-platform")
                .option("origin", "openconfig"));

        PluginOutput output = plugin.process(new TelemetryUpdate(
                SchemaPath.parse("/components/component[name=PSU-1]/state/temperature/instant"), 41.5, 1_000_000_000L));

        MetricSample sample = output.samples().get(0);
        assertEquals("gnmi_components_component_state_temperature_instant", sample.name());
        assertEquals(41.5, sample.value());
        assertEquals("PSU-1", sample.labels().get("name"));
        assertEquals("openconfig-platform", sample.labels().get("data_model"));
        assertEquals("openconfig", plugin.getSubscribedPaths().get(0).origin());
        assertTrue(plugin.getDataModels().contains("openconfig-platform"));
    }

    @Test
    void collidingKeyNamesArePrefixedWithElement() {
        GenericGaugePlugin plugin = plugin(PluginContext.builder()
                .path(SchemaPath.parse("/network-instances")));

        PluginOutput output = plugin.process(new TelemetryUpdate(SchemaPath.parse(
                "/network-instances/network-instance[name=default]/protocols/protocol[name=bgp]/state/enabled"),
                true, 1_000_000_000L));

        MetricSample sample = output.samples().get(0);
        assertEquals("default", sample.labels().get("name"));
        assertEquals("bgp", sample.labels().get("protocol_name"));
        assertEquals(1.0, sample.value());
    }

    @Test
    void nonNumericLeafIsRejected() {
        GenericGaugePlugin plugin = plugin(PluginContext.builder().path(SchemaPath.parse("/system")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> plugin.process(
                new TelemetryUpdate(SchemaPath.parse("/system/state/hostname"), "spine-1", 1L)));
        assertTrue(e.getMessage().contains("/system/state/hostname"));
    }

    @Test
    void pathsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> plugin(PluginContext.builder()));
    }

    private static GenericGaugePlugin plugin(PluginContext.PluginContextBuilder builder) {
        return new GenericGaugePlugin(builder
                .instanceName("lab")
                .targetName("spine-1")
                .metricPrefix("gnmi")
                .pluginType(GenericGaugePlugin.TYPE)
                .build());
    }
}
