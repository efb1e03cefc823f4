package com.wangbin.exporter.core.manager.model;

import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.domain.enums.ValueEncoding;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * 已解析并校验过的目标设备配置，进程生命周期内不变
 */
@Getter
@Builder
@ToString
public class Target {

    private final String name;
    private final String address;
    private final int port;
    private final boolean tls;

    @Builder.Default
    private final SubscribeMode mode = SubscribeMode.SAMPLE;

    private final ValueEncoding forceEncoding;

    private final Duration sampleInterval;

    @Singular
    private final List<PluginBinding> plugins;
}
