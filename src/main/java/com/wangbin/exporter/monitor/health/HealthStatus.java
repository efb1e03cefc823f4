package com.wangbin.exporter.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 导出器整体健康状态。
 * <p>
 * 单个目标不可达只会降级；所有目标都不可达时导出器没有任何可用数据，整体为 DOWN。
 */
@Data
@Builder
public class HealthStatus {

    private final Status status;

    @Builder.Default
    private final long timestamp = System.currentTimeMillis();

    @Builder.Default
    private final Map<String, ComponentHealth> components = new LinkedHashMap<>();

    public enum Status {
        UP,
        DOWN,
        DEGRADED,
        UNKNOWN
    }

    public static HealthStatus of(Collection<ComponentHealth> componentHealths) {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        for (ComponentHealth component : componentHealths) {
            components.put(component.key(), component);
        }
        return HealthStatus.builder()
                .status(aggregate(componentHealths))
                .components(components)
                .build();
    }

    /**
     * 优先级：全部目标不可达 DOWN > 部分不可达 DEGRADED > 存在未知组件 UNKNOWN > UP。
     * 没有配置目标时只看缓存组件
     */
    public static Status aggregate(Collection<ComponentHealth> componentHealths) {
        int targets = 0;
        int unreachable = 0;
        boolean hasUnknown = false;
        for (ComponentHealth component : componentHealths) {
            if (component == null) {
                continue;
            }
            if (component.getKind() == ComponentHealth.Kind.TARGET) {
                targets++;
                if (component.isUnreachable()) {
                    unreachable++;
                }
            }
            if (component.getStatus() == Status.DOWN) {
                return Status.DOWN;
            }
            if (component.getStatus() == Status.UNKNOWN) {
                hasUnknown = true;
            }
        }
        if (targets > 0 && unreachable == targets) {
            return Status.DOWN;
        }
        if (unreachable > 0) {
            return Status.DEGRADED;
        }
        if (hasUnknown) {
            return Status.UNKNOWN;
        }
        return Status.UP;
    }
}
