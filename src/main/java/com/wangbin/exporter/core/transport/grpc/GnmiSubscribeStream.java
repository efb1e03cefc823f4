package com.wangbin.exporter.core.transport.grpc;

import com.wangbin.exporter.common.exception.MalformedMessageException;
import com.wangbin.exporter.core.gnmi.proto.Gnmi;
import com.wangbin.exporter.core.transport.TelemetryStream;
import com.wangbin.exporter.core.transport.model.StreamEvent;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * gNMI Subscribe 双向流。
 * <p>
 * 关闭自动流控，每次只向服务端请求一条消息；会话线程取走一条后再请求下一条，
 * 因此缓冲区中最多只有一条未消费的响应。
 */
@Slf4j
class GnmiSubscribeStream implements TelemetryStream, ClientResponseObserver<Gnmi.SubscribeRequest, Gnmi.SubscribeResponse> {

    private final String targetName;
    private final GnmiMessageConverter converter;
    private final BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);

    private volatile ClientCallStreamObserver<Gnmi.SubscribeRequest> requestStream;

    GnmiSubscribeStream(String targetName, GnmiMessageConverter converter) {
        this.targetName = targetName;
        this.converter = converter;
    }

    @Override
    public void beforeStart(ClientCallStreamObserver<Gnmi.SubscribeRequest> requestStream) {
        this.requestStream = requestStream;
        requestStream.disableAutoRequestWithInitial(1);
    }

    void send(Gnmi.SubscribeRequest request) {
        requestStream.onNext(request);
    }

    @Override
    public void onNext(Gnmi.SubscribeResponse response) {
        events.offer(toEvent(response));
    }

    @Override
    public void onError(Throwable t) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        if (closed.get() && Status.fromThrowable(t).getCode() == Status.Code.CANCELLED) {
            events.offer(StreamEvent.completed());
            return;
        }
        events.offer(StreamEvent.error(t));
    }

    @Override
    public void onCompleted() {
        if (finished.compareAndSet(false, true)) {
            events.offer(StreamEvent.completed());
        }
    }

    @Override
    public StreamEvent next(long timeout, TimeUnit unit) throws InterruptedException {
        StreamEvent event = events.poll(timeout, unit);
        if (event != null && !event.isTerminal() && !closed.get()) {
            requestStream.request(1);
        }
        return event;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ClientCallStreamObserver<Gnmi.SubscribeRequest> stream = requestStream;
        if (stream != null && !finished.get()) {
            try {
                stream.cancel("订阅会话关闭", null);
            } catch (StatusRuntimeException e) {
                log.debug("取消订阅流失败: target={}", targetName, e);
            }
        }
        // 唤醒阻塞中的读取
        events.offer(StreamEvent.completed());
    }

    private StreamEvent toEvent(Gnmi.SubscribeResponse response) {
        switch (response.getResponseCase()) {
            case UPDATE:
                try {
                    return StreamEvent.notification(
                            converter.toNotification(response.getUpdate(), System.currentTimeMillis() * 1_000_000L));
                } catch (MalformedMessageException e) {
                    return StreamEvent.malformed(e.getMessage(), e);
                }
            case SYNC_RESPONSE:
                if (response.getSyncResponse()) {
                    return StreamEvent.syncResponse();
                }
                return StreamEvent.malformed("sync_response 为 false", null);
            default:
                return StreamEvent.malformed("空的订阅响应", null);
        }
    }
}
