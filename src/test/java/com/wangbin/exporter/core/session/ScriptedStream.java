package com.wangbin.exporter.core.session;

import com.wangbin.exporter.core.transport.TelemetryStream;
import com.wangbin.exporter.core.transport.model.StreamEvent;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 测试用订阅流：事件由测试线程推入
 */
public class ScriptedStream implements TelemetryStream {

    private final BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
    private volatile boolean closed = false;

    public ScriptedStream push(StreamEvent event) {
        events.offer(event);
        return this;
    }

    @Override
    public StreamEvent next(long timeout, TimeUnit unit) throws InterruptedException {
        return events.poll(timeout, unit);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            events.offer(StreamEvent.completed());
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
