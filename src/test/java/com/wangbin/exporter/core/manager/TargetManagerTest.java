package com.wangbin.exporter.core.manager;

import com.wangbin.exporter.common.domain.enums.SessionState;
import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.exception.TransportException;
import com.wangbin.exporter.core.config.ExporterProperties;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryNotification;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.manager.model.PluginBinding;
import com.wangbin.exporter.core.manager.model.Target;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.factory.PluginFactory;
import com.wangbin.exporter.core.session.ScriptedStream;
import com.wangbin.exporter.core.session.SubscriptionSession;
import com.wangbin.exporter.core.store.manager.CaffeineMetricStore;
import com.wangbin.exporter.core.store.model.MetricEntry;
import com.wangbin.exporter.core.transport.TelemetryStream;
import com.wangbin.exporter.core.transport.TelemetryTransport;
import com.wangbin.exporter.core.transport.TransportFactory;
import com.wangbin.exporter.core.transport.model.StreamEvent;
import com.wangbin.exporter.core.transport.model.SubscriptionRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class TargetManagerTest {

    private static final String COUNTER = "/interfaces/interface[name=eth0]/state/counters/in-octets";

    private ExporterProperties properties;
    private CaffeineMetricStore store;
    private PluginFactory pluginFactory;
    private ScriptedStream healthyStream;
    private TargetManager manager;

    @BeforeEach
    void setUp() {
        properties = new ExporterProperties();
        properties.getSession().setInitialBackoff(Duration.ofMillis(10));
        properties.getSession().setMaxBackoff(Duration.ofMillis(50));
        properties.getSession().setJitter(0.0);
        properties.getSession().setMaxRetries(0);
        store = new CaffeineMetricStore(properties);
        pluginFactory = new PluginFactory();
        healthyStream = new ScriptedStream();

        TransportFactory factory = request -> new TelemetryTransport() {
            @Override
            public TelemetryStream subscribe(SubscriptionRequest r) throws TransportException {
                if ("leaf-a".equals(r.getTargetName())) {
                    return healthyStream;
                }
                throw new TransportException("connection refused", r.getTargetName());
            }

            @Override
            public void close() {
            }
        };
        manager = new TargetManager(properties, store, factory, pluginFactory, new TargetConfigResolver(pluginFactory));
    }

    @AfterEach
    void tearDown() {
        manager.stop(Duration.ofSeconds(5));
    }

    @Test
    void healthyTargetKeepsStreamingWhileAnotherFails() throws InterruptedException {
        manager.start(List.of(target("leaf-a"), target("leaf-b")));

        healthyStream.push(StreamEvent.syncResponse());
        healthyStream.push(StreamEvent.notification(counter(100L)));
        awaitTrue(() -> valueOf("leaf-a") == 100.0);

        SubscriptionSession failing = manager.getSession("leaf-b");
        awaitTrue(() -> failing.getConnectAttempts() >= 3);

        healthyStream.push(StreamEvent.notification(counter(250L)));
        awaitTrue(() -> valueOf("leaf-a") == 250.0);

        assertEquals(SessionState.STREAMING, manager.getSession("leaf-a").getState());
        assertNotEquals(SessionState.STREAMING, failing.getState());
        assertEquals(2, manager.getConfiguredTargetCount());
    }

    @Test
    void stopRemovesAllTargetMetrics() throws InterruptedException {
        manager.start(List.of(target("leaf-a")));
        healthyStream.push(StreamEvent.syncResponse());
        healthyStream.push(StreamEvent.notification(counter(100L)));
        awaitTrue(() -> store.size() == 1);

        SubscriptionSession session = manager.getSession("leaf-a");
        manager.stop(Duration.ofSeconds(5));

        assertEquals(0, store.size());
        assertEquals(SessionState.CLOSED, session.getState());
        assertTrue(manager.getSessions().isEmpty());
    }

    @Test
    void requestCarriesUnionOfPluginPaths() {
        Target target = Target.builder()
                .name("leaf-a")
                .address("10.0.0.1")
                .port(9339)
                .sampleInterval(Duration.ofSeconds(30))
                .plugin(PluginBinding.builder().type("oc_interfaces").build())
                .plugin(PluginBinding.builder().type("oc_interfaces_rate").build())
                .build();

        SubscriptionRequest request = manager.buildRequest(target, List.of(
                pluginFactory.createPlugin(context("oc_interfaces")),
                pluginFactory.createPlugin(context("oc_interfaces_rate"))));

        assertEquals(3, request.getPaths().size());
        assertEquals(1, request.getDataModels().size());
        assertTrue(request.getDataModels().contains("openconfig-interfaces"));
        assertEquals("10.0.0.1:9339", request.endpoint());
        assertEquals(Duration.ofSeconds(30), request.getSampleInterval());
    }

    @Test
    void onChangeTargetRequestsHeartbeatAtSampleInterval() {
        Target target = Target.builder()
                .name("leaf-a")
                .address("10.0.0.1")
                .port(9339)
                .mode(SubscribeMode.ON_CHANGE)
                .sampleInterval(Duration.ofSeconds(30))
                .plugin(PluginBinding.builder().type("oc_interfaces").build())
                .build();

        SubscriptionRequest onChange = manager.buildRequest(target,
                List.of(pluginFactory.createPlugin(context("oc_interfaces"))));
        SubscriptionRequest sample = manager.buildRequest(target("leaf-b"),
                List.of(pluginFactory.createPlugin(context("oc_interfaces"))));

        assertTrue(onChange.hasHeartbeat());
        assertEquals(Duration.ofSeconds(30), onChange.getHeartbeatInterval());
        assertFalse(sample.hasHeartbeat());
    }

    private double valueOf(String device) {
        for (MetricEntry entry : store.snapshot()) {
            if (device.equals(entry.labels().get("device"))) {
                return entry.value();
            }
        }
        return -1;
    }

    private static Target target(String name) {
        return Target.builder()
                .name(name)
                .address("127.0.0.1")
                .port(9339)
                .sampleInterval(Duration.ofSeconds(30))
                .plugin(PluginBinding.builder().type("oc_interfaces").build())
                .build();
    }

    private static PluginContext context(String type) {
        return PluginContext.builder()
                .instanceName("default")
                .targetName("leaf-a")
                .metricPrefix("gnmi")
                .pluginType(type)
                .build();
    }

    private static TelemetryNotification counter(long value) {
        long now = System.currentTimeMillis() * 1_000_000L;
        return new TelemetryNotification(now, List.of(new TelemetryUpdate(SchemaPath.parse(COUNTER), value, now)),
                List.of(), false);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
