package com.wangbin.exporter.monitor.health;

import com.wangbin.exporter.common.domain.enums.SessionState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    private static final ComponentHealth STORE = ComponentHealth.forStore(Map.of("size", 0L));

    @Test
    void storeOnlyIsUp() {
        assertEquals(HealthStatus.Status.UP, HealthStatus.aggregate(List.of(STORE)));
    }

    @Test
    void oneUnreachableTargetDegrades() {
        HealthStatus health = HealthStatus.of(List.of(
                target("leaf-a", SessionState.STREAMING),
                target("leaf-b", SessionState.BACKOFF),
                STORE));

        assertEquals(HealthStatus.Status.DEGRADED, health.getStatus());
        assertTrue(health.getComponents().containsKey("target:leaf-b"));
        assertTrue(health.getComponents().get("target:leaf-b").isUnreachable());
        assertEquals("backing-off", health.getComponents().get("target:leaf-b").getDetails().get("state"));
    }

    @Test
    void allTargetsUnreachableIsDown() {
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.aggregate(List.of(
                target("leaf-a", SessionState.FAILED),
                target("leaf-b", SessionState.BACKOFF),
                STORE)));
    }

    @Test
    void connectingTargetIsUnknownNotDown() {
        ComponentHealth connecting = target("leaf-a", SessionState.CONNECTING);

        assertEquals(HealthStatus.Status.UNKNOWN, connecting.getStatus());
        assertFalse(connecting.isUnreachable());
        assertEquals(HealthStatus.Status.UNKNOWN, HealthStatus.aggregate(List.of(connecting, STORE)));
    }

    @Test
    void failedTargetReportsSustainedFailure() {
        ComponentHealth failed = target("leaf-a", SessionState.FAILED);

        assertEquals("Sustained failure", failed.getMessage());
        assertEquals("connection refused", failed.getDetails().get("lastError"));
    }

    private static ComponentHealth target(String name, SessionState state) {
        return ComponentHealth.forTarget(TargetHealth.builder()
                .targetName(name)
                .endpoint("127.0.0.1:9339")
                .state(state.getCode())
                .healthState(state.healthState())
                .lastError(state.isUnreachable() ? "connection refused" : null)
                .build());
    }
}
