package com.wangbin.exporter.core.session;

import com.wangbin.exporter.core.config.ExporterProperties;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * 会话运行参数
 */
@Getter
@Builder
public class SessionSettings {

    /**
     * 数据流静默超过该时长视为断开
     */
    private final Duration watchdogTimeout;

    /**
     * 连续失败次数上限，超过后进入长时间休眠；0 表示不限
     */
    private final int maxRetries;

    private final Duration failedRetryInterval;

    /**
     * 连续无法解析的消息数量上限
     */
    private final int malformedThreshold;

    public static SessionSettings from(ExporterProperties properties) {
        ExporterProperties.SessionConfig session = properties.getSession();
        return SessionSettings.builder()
                .watchdogTimeout(properties.getScrapeInterval().multipliedBy(properties.getWatchdogMultiplier()))
                .maxRetries(session.getMaxRetries())
                .failedRetryInterval(session.getFailedRetryInterval())
                .malformedThreshold(session.getMalformedThreshold())
                .build();
    }
}
