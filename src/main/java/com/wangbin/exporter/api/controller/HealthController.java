package com.wangbin.exporter.api.controller;

import com.wangbin.exporter.core.manager.TargetManager;
import com.wangbin.exporter.core.session.SubscriptionSession;
import com.wangbin.exporter.monitor.health.HealthStatus;
import com.wangbin.exporter.monitor.health.TargetHealth;
import com.wangbin.exporter.monitor.health.TargetHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 健康检查接口。全部目标不可达时返回 503。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final TargetHealthService targetHealthService;
    private final TargetManager targetManager;

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus health = targetHealthService.getHealth();
        HttpStatus status = health.getStatus() == HealthStatus.Status.DOWN
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/health/targets")
    public List<TargetHealth> targets() {
        return targetHealthService.getTargetHealth();
    }

    @GetMapping("/health/targets/{name}/plugins")
    public ResponseEntity<Map<String, Object>> plugins(@PathVariable("name") String name) {
        SubscriptionSession session = targetManager.getSession(name);
        if (session == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(session.getDispatcher().getStatistics());
    }
}
