package com.wangbin.exporter.core.session;

import com.wangbin.exporter.common.domain.enums.SessionState;
import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.exception.TransportException;
import com.wangbin.exporter.core.dispatch.PluginDispatcher;
import com.wangbin.exporter.core.store.manager.MetricStore;
import com.wangbin.exporter.core.store.model.EvictionMode;
import com.wangbin.exporter.core.transport.TelemetryStream;
import com.wangbin.exporter.core.transport.TelemetryTransport;
import com.wangbin.exporter.core.transport.TransportFactory;
import com.wangbin.exporter.core.transport.model.StreamEvent;
import com.wangbin.exporter.core.transport.model.SubscriptionRequest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 订阅会话，与目标一一对应，运行在独立线程上。
 * <pre>
 * IDLE -> CONNECTING -> SYNCING -> STREAMING -> BACKOFF -> CONNECTING -> ...
 *                                                BACKOFF -> FAILED（超过最大重试次数，长时间休眠后重来）
 * 任意状态 -> CLOSED（仅由管理器关闭）
 * </pre>
 * 流中断、设备关闭流、看门狗超时、连续畸形消息超过阈值都会进入 BACKOFF；
 * 进入 BACKOFF 时先作废当前代次，再把该目标的指标标记为失效，进入 FAILED 时被删除。
 */
@Slf4j
public class SubscriptionSession implements Runnable {

    /**
     * 退避等待。返回 true 表示等待期间会话被关闭
     */
    @FunctionalInterface
    public interface Sleeper {
        boolean sleep(long millis) throws InterruptedException;
    }

    @Getter
    private final String targetName;
    @Getter
    private final SubscriptionRequest request;
    private final TransportFactory transportFactory;
    @Getter
    private final PluginDispatcher dispatcher;
    private final MetricStore store;
    private final BackoffPolicy backoffPolicy;
    private final SessionSettings settings;
    private final Sleeper sleeper;

    private final CountDownLatch closeSignal = new CountDownLatch(1);
    private final AtomicLong epoch = new AtomicLong(0);

    @Getter
    private volatile SessionState state = SessionState.IDLE;
    @Getter
    private volatile boolean synced = false;
    @Getter
    private volatile long lastSuccessTime = 0L;
    @Getter
    private volatile long stateChangedTime = System.currentTimeMillis();
    @Getter
    private volatile String lastError;
    @Getter
    private volatile long lastErrorTime = 0L;
    @Getter
    private volatile int retries = 0;
    @Getter
    private volatile long nextRetryDelay = 0L;

    private volatile boolean closing = false;
    private volatile TelemetryStream currentStream;

    // 统计计数器
    private final AtomicLong notificationsReceived = new AtomicLong(0);
    private final AtomicLong malformedMessages = new AtomicLong(0);
    private final AtomicLong connectAttempts = new AtomicLong(0);

    public SubscriptionSession(SubscriptionRequest request,
                               TransportFactory transportFactory,
                               PluginDispatcher dispatcher,
                               MetricStore store,
                               BackoffPolicy backoffPolicy,
                               SessionSettings settings) {
        this(request, transportFactory, dispatcher, store, backoffPolicy, settings, null);
    }

    public SubscriptionSession(SubscriptionRequest request,
                               TransportFactory transportFactory,
                               PluginDispatcher dispatcher,
                               MetricStore store,
                               BackoffPolicy backoffPolicy,
                               SessionSettings settings,
                               Sleeper sleeper) {
        this.targetName = request.getTargetName();
        this.request = request;
        this.transportFactory = transportFactory;
        this.dispatcher = dispatcher;
        this.store = store;
        this.backoffPolicy = backoffPolicy;
        this.settings = settings;
        this.sleeper = sleeper != null ? sleeper : millis -> closeSignal.await(millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void run() {
        log.info("订阅会话启动: target={}, endpoint={}, paths={}", targetName, request.endpoint(), request.getPaths().size());
        dispatcher.start();
        try {
            while (!closing) {
                long streamEpoch = epoch.incrementAndGet();
                connectAndStream(streamEpoch);
                if (closing) {
                    break;
                }
                backoff(streamEpoch);
            }
        } catch (InterruptedException e) {
            log.info("订阅会话被中断: target={}", targetName);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("订阅会话异常退出: target={}", targetName, e);
            recordError(e.getMessage());
        } finally {
            transition(SessionState.CLOSED);
            dispatcher.stop(1000L);
            log.info("订阅会话已关闭: target={}", targetName);
        }
    }

    /**
     * 请求关闭：唤醒退避等待并取消当前订阅流
     */
    public void close() {
        closing = true;
        closeSignal.countDown();
        TelemetryStream stream = currentStream;
        if (stream != null) {
            stream.close();
        }
    }

    public boolean isClosing() {
        return closing;
    }

    private void connectAndStream(long streamEpoch) throws InterruptedException {
        synced = false;
        connectAttempts.incrementAndGet();
        transition(SessionState.CONNECTING);
        log.info("开始连接设备: target={}, endpoint={}, attempt={}", targetName, request.endpoint(), retries + 1);

        try (TelemetryTransport transport = transportFactory.create(request)) {
            TelemetryStream stream = transport.subscribe(request);
            currentStream = stream;
            try {
                if (closing) {
                    return;
                }
                transition(SessionState.SYNCING);
                consume(stream, streamEpoch);
            } finally {
                currentStream = null;
                stream.close();
            }
        } catch (TransportException e) {
            recordError(e.getMessage());
            log.warn("连接设备失败: target={}, error={}", targetName, e.getMessage());
        } catch (RuntimeException e) {
            recordError(e.getMessage());
            log.warn("订阅流异常: target={}", targetName, e);
        }
    }

    private void consume(TelemetryStream stream, long streamEpoch) throws InterruptedException {
        long watchdogMillis = watchdogMillis();
        int malformedInRow = 0;
        while (!closing) {
            StreamEvent event = stream.next(watchdogMillis, TimeUnit.MILLISECONDS);
            if (event == null) {
                if (!watchdogEnabled()) {
                    continue;
                }
                recordError("数据流静默超过 " + watchdogMillis + " 毫秒");
                log.warn("看门狗超时，断开订阅流: target={}, timeout={}ms", targetName, watchdogMillis);
                return;
            }
            switch (event.kind()) {
                case NOTIFICATION:
                    malformedInRow = 0;
                    markSuccess();
                    notificationsReceived.incrementAndGet();
                    dispatcher.dispatch(event.notification(), streamEpoch, synced);
                    break;
                case SYNC_RESPONSE:
                    malformedInRow = 0;
                    markSuccess();
                    if (!synced) {
                        synced = true;
                        dispatcher.signalSync(streamEpoch, true);
                        transition(SessionState.STREAMING);
                        log.info("初始同步完成: target={}", targetName);
                    }
                    break;
                case MALFORMED:
                    malformedInRow++;
                    malformedMessages.incrementAndGet();
                    log.warn("收到无法解析的消息: target={}, detail={}, consecutive={}",
                            targetName, event.detail(), malformedInRow);
                    if (malformedInRow >= settings.getMalformedThreshold()) {
                        recordError("连续 " + malformedInRow + " 条消息无法解析");
                        return;
                    }
                    break;
                case ERROR:
                    recordError(event.detail());
                    log.warn("订阅流异常结束: target={}, error={}", targetName, event.detail());
                    return;
                case COMPLETED:
                default:
                    if (!closing) {
                        recordError("设备关闭了订阅流");
                        log.warn("设备关闭了订阅流: target={}", targetName);
                    }
                    return;
            }
        }
    }

    /**
     * ON_CHANGE 且没有心跳时，设备没有变化就不会发送任何消息，静默不代表断开
     */
    boolean watchdogEnabled() {
        return request.getMode() != SubscribeMode.ON_CHANGE || request.hasHeartbeat();
    }

    long watchdogMillis() {
        long millis = settings.getWatchdogTimeout().toMillis();
        if (request.getMode() == SubscribeMode.ON_CHANGE && request.hasHeartbeat()) {
            // 至少容忍两个心跳周期
            millis = Math.max(millis, request.getHeartbeatInterval().toMillis() * 2);
        }
        return millis;
    }

    private void backoff(long streamEpoch) throws InterruptedException {
        synced = false;
        transition(SessionState.BACKOFF);
        dispatcher.signalSync(streamEpoch, false);
        // 先作废本代次，队列中残留的旧数据不会把失效条目重新写成有效
        dispatcher.retireEpoch(streamEpoch);
        int marked = store.evictTarget(targetName, EvictionMode.MARK_STALE);
        retries++;

        int maxRetries = settings.getMaxRetries();
        if (maxRetries > 0 && retries > maxRetries) {
            transition(SessionState.FAILED);
            int removed = store.evictTarget(targetName, EvictionMode.REMOVE);
            long sleepMillis = settings.getFailedRetryInterval().toMillis();
            nextRetryDelay = sleepMillis;
            log.error("连续 {} 次连接失败，进入长时间休眠: target={}, sleep={}ms, removedEntries={}, lastError={}",
                    retries - 1, targetName, sleepMillis, removed, lastError);
            if (!sleeper.sleep(sleepMillis)) {
                retries = 0;
            }
            return;
        }

        long delay = backoffPolicy.delayMillis(retries);
        nextRetryDelay = delay;
        log.info("等待 {} 毫秒后重连: target={}, retries={}, staleEntries={}", delay, targetName, retries, marked);
        sleeper.sleep(delay);
    }

    private void markSuccess() {
        lastSuccessTime = System.currentTimeMillis();
        retries = 0;
    }

    private void recordError(String message) {
        lastError = message;
        lastErrorTime = System.currentTimeMillis();
    }

    private void transition(SessionState next) {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        stateChangedTime = System.currentTimeMillis();
        log.info("会话状态变更: target={}, {} -> {}", targetName, previous, next);
    }

    public long getEpoch() {
        return epoch.get();
    }

    public long getNotificationsReceived() {
        return notificationsReceived.get();
    }

    public long getMalformedMessages() {
        return malformedMessages.get();
    }

    public long getConnectAttempts() {
        return connectAttempts.get();
    }
}
