package com.wangbin.exporter.core.transport;

import com.wangbin.exporter.core.transport.model.StreamEvent;

import java.util.concurrent.TimeUnit;

/**
 * 已建立的订阅流，由会话线程独占读取
 */
public interface TelemetryStream extends AutoCloseable {

    /**
     * 读取下一个事件
     *
     * @return 事件；超时返回 null
     */
    StreamEvent next(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 取消流。可由其他线程调用，阻塞中的 {@link #next} 会收到 COMPLETED 事件
     */
    @Override
    void close();
}
