package com.wangbin.exporter.monitor.health;

import com.wangbin.exporter.common.domain.enums.SessionState;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查中的一个组件：一个目标会话，或指标缓存
 */
@Data
@Builder
public class ComponentHealth {

    public static final String STORE_COMPONENT = "metricStore";
    public static final String TARGET_PREFIX = "target:";

    public enum Kind {
        TARGET,
        STORE
    }

    private final String name;
    private final Kind kind;
    private final HealthStatus.Status status;
    private final String message;

    /**
     * 目标当前不可达（BACKOFF 或 FAILED）
     */
    private final boolean unreachable;

    @Builder.Default
    private final Map<String, Object> details = new LinkedHashMap<>();

    @Builder.Default
    private final long checkedAt = System.currentTimeMillis();

    /**
     * 会话状态到组件状态的映射：STREAMING 为 UP，不可达为 DEGRADED，连接/同步中为 UNKNOWN
     */
    public static ComponentHealth forTarget(TargetHealth target) {
        SessionState state = SessionState.fromCode(target.getState());
        HealthStatus.Status status;
        if (state == SessionState.STREAMING) {
            status = HealthStatus.Status.UP;
        } else if (state.isUnreachable()) {
            status = HealthStatus.Status.DEGRADED;
        } else {
            status = HealthStatus.Status.UNKNOWN;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", target.getHealthState());
        details.put("synced", target.isSynced());
        details.put("lastSuccessTime", target.getLastSuccessTime());
        details.put("retries", target.getRetries());
        if (target.getLastError() != null) {
            details.put("lastError", target.getLastError());
        }

        return ComponentHealth.builder()
                .name(target.getTargetName())
                .kind(Kind.TARGET)
                .status(status)
                .unreachable(state.isUnreachable())
                .message(state == SessionState.FAILED ? "Sustained failure" : state.getDescription())
                .details(details)
                .build();
    }

    public static ComponentHealth forStore(Map<String, Object> statistics) {
        return ComponentHealth.builder()
                .name(STORE_COMPONENT)
                .kind(Kind.STORE)
                .status(HealthStatus.Status.UP)
                .message("Metric store statistics")
                .details(new LinkedHashMap<>(statistics))
                .build();
    }

    public static ComponentHealth storeUnavailable(String error) {
        return ComponentHealth.builder()
                .name(STORE_COMPONENT)
                .kind(Kind.STORE)
                .status(HealthStatus.Status.UNKNOWN)
                .message("Failed to read store statistics: " + error)
                .build();
    }

    public String key() {
        return kind == Kind.TARGET ? TARGET_PREFIX + name : name;
    }
}
