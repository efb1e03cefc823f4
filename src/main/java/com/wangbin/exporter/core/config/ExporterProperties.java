package com.wangbin.exporter.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 导出器配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "exporter")
public class ExporterProperties {

    /**
     * 实例名，作为 instance_name 标签
     */
    private String instanceName = "default";

    /**
     * 指标名前缀
     */
    private String metricPrefix = "gnmi";

    /**
     * 抓取周期，采样间隔 = scrapeInterval / oversampling
     */
    private Duration scrapeInterval = Duration.ofSeconds(60);

    private int oversampling = 2;

    /**
     * 数据流静默超过 scrapeInterval * watchdogMultiplier 视为断开
     */
    private int watchdogMultiplier = 3;

    /**
     * 会话配置
     */
    private SessionConfig session = new SessionConfig();

    /**
     * 插件分发配置
     */
    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * 指标缓存配置
     */
    private StoreConfig store = new StoreConfig();

    /**
     * 设备模板，设备未配置的项从这里继承
     */
    private DeviceConfig deviceTemplate = new DeviceConfig();

    /**
     * 设备列表
     */
    private List<DeviceConfig> devices = new ArrayList<>();

    // =============== 配置类定义 ===============

    @Data
    public static class SessionConfig {
        private Duration rpcTimeout = Duration.ofSeconds(10);
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private double backoffMultiplier = 2.0;
        private double jitter = 0.2;
        private int maxRetries = 10;
        private Duration failedRetryInterval = Duration.ofMinutes(10);
        private int malformedThreshold = 20;
        private Duration stopTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class DispatchConfig {
        private int queueCapacity = 1024;
        private int batchSize = 64;
        private String overflowStrategy = "BLOCK";
        private Duration offerTimeout = Duration.ofMillis(50);
    }

    @Data
    public static class StoreConfig {
        private Duration stalenessThreshold = Duration.ofMinutes(5);
        private long evictionIntervalMs = 30000;
        private long maxEntries = 1_000_000L;
        private boolean exposeStale = false;
    }

    @Data
    public static class DeviceConfig {
        private String name;
        private String address;
        private Integer port;
        private String mode;
        private String forceEncoding;
        private Boolean tls;
        private List<PluginConfig> plugins;
    }

    @Data
    public static class PluginConfig {
        private String type;
        private List<String> paths;
        private String match;
        private Map<String, String> options = new LinkedHashMap<>();
    }
}
