package com.wangbin.exporter.monitor.health;

import com.wangbin.exporter.common.domain.enums.SessionState;
import com.wangbin.exporter.core.manager.TargetManager;
import com.wangbin.exporter.core.session.SubscriptionSession;
import com.wangbin.exporter.core.store.manager.MetricStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 聚合目标会话与指标缓存的健康信息
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TargetHealthService {

    private final TargetManager targetManager;
    private final MetricStore metricStore;

    public List<TargetHealth> getTargetHealth() {
        List<TargetHealth> list = new ArrayList<>();
        for (SubscriptionSession session : targetManager.getSessions()) {
            list.add(toTargetHealth(session));
        }
        return list;
    }

    public HealthStatus getHealth() {
        List<ComponentHealth> components = new ArrayList<>();
        for (TargetHealth target : getTargetHealth()) {
            components.add(ComponentHealth.forTarget(target));
        }
        components.add(buildStoreComponent());
        return HealthStatus.of(components);
    }

    TargetHealth toTargetHealth(SubscriptionSession session) {
        SessionState state = session.getState();
        return TargetHealth.builder()
                .targetName(session.getTargetName())
                .endpoint(session.getRequest().endpoint())
                .state(state.getCode())
                .healthState(state.healthState())
                .synced(session.isSynced())
                .lastSuccessTime(session.getLastSuccessTime())
                .stateChangedTime(session.getStateChangedTime())
                .retries(session.getRetries())
                .nextRetryDelay(session.getNextRetryDelay())
                .lastError(session.getLastError())
                .lastErrorTime(session.getLastErrorTime())
                .notificationsReceived(session.getNotificationsReceived())
                .malformedMessages(session.getMalformedMessages())
                .pluginErrors(session.getDispatcher().getPluginErrors())
                .build();
    }

    private ComponentHealth buildStoreComponent() {
        try {
            return ComponentHealth.forStore(metricStore.getStatistics());
        } catch (RuntimeException e) {
            log.warn("获取指标缓存状态失败", e);
            return ComponentHealth.storeUnavailable(e.getMessage());
        }
    }
}
