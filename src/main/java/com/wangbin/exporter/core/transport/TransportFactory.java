package com.wangbin.exporter.core.transport;

import com.wangbin.exporter.core.transport.model.SubscriptionRequest;

/**
 * 传输通道工厂
 */
@FunctionalInterface
public interface TransportFactory {

    TelemetryTransport create(SubscriptionRequest request);
}
