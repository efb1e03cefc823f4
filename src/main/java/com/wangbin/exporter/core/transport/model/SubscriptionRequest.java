package com.wangbin.exporter.core.transport.model;

import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.domain.enums.ValueEncoding;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * 一个目标的订阅请求参数，由会话在启动时根据插件绑定计算
 */
@Getter
@Builder
@ToString
public class SubscriptionRequest {

    private final String targetName;
    private final String address;
    private final int port;
    private final boolean tls;

    /**
     * 全部插件路径的并集
     */
    @Singular
    private final List<PathSubscription> paths;

    private final SubscribeMode mode;

    /**
     * 采样间隔，仅 SAMPLE 模式有效
     */
    private final Duration sampleInterval;

    /**
     * 心跳间隔，仅 ON_CHANGE 模式有效：设备即使没有变化也按该间隔重发当前值。
     * 为 null 时不请求心跳
     */
    private final Duration heartbeatInterval;

    /**
     * 强制编码，为 null 时按设备能力选择
     */
    private final ValueEncoding forceEncoding;

    /**
     * 插件要求设备支持的数据模型
     */
    @Singular
    private final Set<String> dataModels;

    @Builder.Default
    private final Duration rpcTimeout = Duration.ofSeconds(10);

    public boolean hasHeartbeat() {
        return heartbeatInterval != null && !heartbeatInterval.isZero() && !heartbeatInterval.isNegative();
    }

    public String endpoint() {
        return address + ":" + port;
    }
}
