package com.wangbin.exporter.core.transport;

import com.wangbin.exporter.common.exception.TransportException;
import com.wangbin.exporter.core.transport.model.SubscriptionRequest;

/**
 * 面向设备的传输通道，每次连接尝试创建一个实例
 */
public interface TelemetryTransport extends AutoCloseable {

    /**
     * 能力检查 + 建立订阅流
     *
     * @throws TransportException 拨号、能力查询或订阅失败
     */
    TelemetryStream subscribe(SubscriptionRequest request) throws TransportException;

    /**
     * 释放底层连接
     */
    @Override
    void close();
}
