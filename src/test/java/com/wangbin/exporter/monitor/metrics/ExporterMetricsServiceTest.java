package com.wangbin.exporter.monitor.metrics;

import com.wangbin.exporter.core.config.ExporterProperties;
import com.wangbin.exporter.core.manager.TargetConfigResolver;
import com.wangbin.exporter.core.manager.TargetManager;
import com.wangbin.exporter.core.plugin.factory.PluginFactory;
import com.wangbin.exporter.core.store.manager.CaffeineMetricStore;
import com.wangbin.exporter.core.store.model.EvictionMode;
import com.wangbin.exporter.core.store.model.MetricEntry;
import com.wangbin.exporter.core.store.model.MetricOwner;
import com.wangbin.exporter.core.store.model.MetricSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExporterMetricsServiceTest {

    private ExporterProperties properties;
    private CaffeineMetricStore store;
    private ExporterMetricsService service;

    @BeforeEach
    void setUp() {
        properties = new ExporterProperties();
        properties.setInstanceName("lab");
        store = new CaffeineMetricStore(properties);
        PluginFactory pluginFactory = new PluginFactory();
        TargetManager targetManager = new TargetManager(properties, store, request -> {
            throw new IllegalStateException("not used");
        }, pluginFactory, new TargetConfigResolver(pluginFactory));
        service = new ExporterMetricsService(properties, store, targetManager);

        store.write(MetricSample.gauge("gnmi_iface_mtu", Map.of("device", "spine-1"), 1500, 1),
                new MetricOwner("spine-1", "oc_interfaces"), true);
        store.write(MetricSample.gauge("gnmi_iface_mtu", Map.of("device", "leaf-1"), 9000, 1),
                new MetricOwner("leaf-1", "oc_interfaces"), true);
    }

    @Test
    void staleEntriesAreHiddenByDefault() {
        store.evictTarget("leaf-1", EvictionMode.MARK_STALE);

        String text = service.scrape();

        assertTrue(text.contains("gnmi_iface_mtu{device=\"spine-1\"} 1500"));
        assertFalse(text.contains("leaf-1"));
        assertTrue(text.contains("gnmi_collected_series{instance_name=\"lab\"} 1"));
        assertTrue(text.contains("gnmi_collected_metrics{instance_name=\"lab\"} 1"));
    }

    @Test
    void staleEntriesCanBeExposed() {
        properties.getStore().setExposeStale(true);
        store.evictTarget("leaf-1", EvictionMode.MARK_STALE);

        String text = service.scrape();

        assertTrue(text.contains("gnmi_iface_mtu{device=\"leaf-1\"} 9000"));
    }

    @Test
    void selfMetricsAreIncludedAndSorted() {
        List<MetricEntry> entries = service.collect();

        assertTrue(entries.stream().anyMatch(e -> e.name().equals("gnmi_configured_devices")));
        assertTrue(entries.stream().anyMatch(e -> e.name().equals("gnmi_collected_devices") && e.value() == 0));
        for (int i = 1; i < entries.size(); i++) {
            assertTrue(entries.get(i - 1).key().compareTo(entries.get(i).key()) <= 0);
        }
    }
}
