package com.wangbin.exporter.core.dispatch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.exporter.core.dispatch.model.DispatchItem;
import com.wangbin.exporter.core.plugin.base.PluginOutput;
import com.wangbin.exporter.core.plugin.base.TelemetryPlugin;
import com.wangbin.exporter.core.store.manager.MetricStore;
import com.wangbin.exporter.core.store.model.MetricOwner;
import com.wangbin.exporter.core.store.model.MetricSample;
import com.wangbin.exporter.core.store.model.WriteResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个插件的工作线程：有界队列 + 批量取出 + 逐项处理。
 * <p>
 * 插件异常在这里被捕获并记录，不会影响订阅流的读取，也不会影响同一目标的其他插件。
 */
@Slf4j
public class PluginWorker implements AutoCloseable {

    private final String targetName;
    @Getter
    private final TelemetryPlugin plugin;
    private final MetricOwner owner;
    private final MetricStore store;
    private final BlockingQueue<DispatchItem> queue;
    private final int batchSize;
    private final OverflowStrategy overflowStrategy;
    private final long offerTimeoutMillis;
    private final Thread workerThread;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // 写入与代次作废互斥：作废返回后，旧代次的更新不会再落入缓存
    private final Object applyLock = new Object();
    private volatile long retiredEpoch = 0L;

    // 以下状态只在工作线程内访问
    private long currentEpoch = -1;
    private boolean synced = false;

    // 统计计数器
    private final AtomicLong enqueued = new AtomicLong(0);
    private final AtomicLong processed = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong pluginErrors = new AtomicLong(0);
    private final AtomicLong written = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);
    private final AtomicLong removed = new AtomicLong(0);
    private final AtomicLong discarded = new AtomicLong(0);

    public PluginWorker(String targetName,
                        TelemetryPlugin plugin,
                        MetricStore store,
                        int capacity,
                        int batchSize,
                        OverflowStrategy overflowStrategy,
                        long offerTimeoutMillis) {
        this.targetName = targetName;
        this.plugin = plugin;
        this.owner = new MetricOwner(targetName, plugin.getType());
        this.store = store;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.batchSize = Math.max(1, batchSize);
        this.overflowStrategy = overflowStrategy != null ? overflowStrategy : OverflowStrategy.BLOCK;
        this.offerTimeoutMillis = Math.max(0L, offerTimeoutMillis);
        this.workerThread = new ThreadFactoryBuilder()
                .setNameFormat("plugin-" + targetName + "-" + plugin.getType() + "-%d")
                .setDaemon(true)
                .build()
                .newThread(this::processLoop);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread.start();
        }
    }

    /**
     * 停止工作线程，未处理的项被丢弃
     */
    public void stop(long timeoutMillis) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        workerThread.interrupt();
        try {
            workerThread.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int pending = queue.size();
        queue.clear();
        if (pending > 0) {
            log.debug("插件工作线程停止，丢弃未处理项: target={}, plugin={}, pending={}",
                    targetName, plugin.getType(), pending);
        }
    }

    /**
     * 入队，按溢出策略处理队列满的情况
     *
     * @return 是否成功入队
     */
    public boolean enqueue(DispatchItem item) {
        if (item == null) {
            return false;
        }
        boolean accepted;
        switch (overflowStrategy) {
            case DROP_LATEST:
                accepted = queue.offer(item);
                break;
            case DROP_OLDEST:
                while (!queue.offer(item)) {
                    if (queue.poll() != null) {
                        dropped.incrementAndGet();
                    }
                }
                accepted = true;
                break;
            case BLOCK:
            default:
                try {
                    accepted = queue.offer(item, offerTimeoutMillis, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    accepted = false;
                }
                break;
        }
        if (accepted) {
            enqueued.incrementAndGet();
        } else {
            dropped.incrementAndGet();
            log.debug("插件队列已满，丢弃: target={}, plugin={}, kind={}, path={}",
                    targetName, plugin.getType(), item.kind(), item.path());
        }
        return accepted;
    }

    /**
     * 作废不大于 epoch 的全部代次。
     * <p>
     * 若工作线程正在写入缓存，本方法等待写入结束后返回；此后这些代次的更新和删除都被丢弃，
     * 调用方可以安全地标记失效或删除该目标的指标。
     */
    public void retireEpoch(long epoch) {
        synchronized (applyLock) {
            if (epoch > retiredEpoch) {
                retiredEpoch = epoch;
            }
        }
    }

    private void processLoop() {
        List<DispatchItem> batch = new ArrayList<>(batchSize);
        while (running.get()) {
            try {
                DispatchItem first = queue.take();
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                for (DispatchItem item : batch) {
                    handle(item);
                }
                batch.clear();
            } catch (InterruptedException e) {
                if (!running.get()) {
                    Thread.currentThread().interrupt();
                    break;
                }
            } catch (Exception ex) {
                batch.clear();
                log.warn("插件队列处理异常: target={}, plugin={}", targetName, plugin.getType(), ex);
            }
        }
    }

    void handle(DispatchItem item) {
        if (item.kind() != DispatchItem.Kind.SYNC && item.epoch() <= retiredEpoch) {
            discarded.incrementAndGet();
            return;
        }
        try {
            if (item.epoch() != currentEpoch) {
                if (currentEpoch >= 0) {
                    // 新的订阅流，上一条流的派生状态作废
                    plugin.onSyncStatusChanged(false);
                    synced = false;
                }
                currentEpoch = item.epoch();
            }
            if (item.synced() != synced) {
                synced = item.synced();
                plugin.onSyncStatusChanged(synced);
            }

            PluginOutput output;
            switch (item.kind()) {
                case UPDATE:
                    output = plugin.process(item.update());
                    break;
                case DELETE:
                    output = plugin.onDelete(item.path());
                    break;
                default:
                    output = PluginOutput.empty();
                    break;
            }
            synchronized (applyLock) {
                if (item.kind() != DispatchItem.Kind.SYNC && item.epoch() <= retiredEpoch) {
                    discarded.incrementAndGet();
                    return;
                }
                apply(output);
            }
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            pluginErrors.incrementAndGet();
            log.error("插件处理异常: target={}, plugin={}, path={}, value={}",
                    targetName, plugin.getType(), item.path(),
                    item.update() == null ? null : item.update().value(), e);
        }
    }

    private void apply(PluginOutput output) {
        for (MetricSample sample : output.samples()) {
            WriteResult result = store.write(sample, owner, synced);
            if (result.isAccepted()) {
                written.incrementAndGet();
            } else {
                rejected.incrementAndGet();
            }
        }
        if (!output.retracted().isEmpty()) {
            removed.addAndGet(store.remove(output.retracted(), owner));
        }
    }

    public long getDiscarded() {
        return discarded.get();
    }

    public long getPluginErrors() {
        return pluginErrors.get();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>(plugin.getStatistics());
        stats.put("queueSize", queue.size());
        stats.put("enqueued", enqueued.get());
        stats.put("processed", processed.get());
        stats.put("dropped", dropped.get());
        stats.put("pluginErrors", pluginErrors.get());
        stats.put("written", written.get());
        stats.put("rejected", rejected.get());
        stats.put("removed", removed.get());
        stats.put("discarded", discarded.get());
        return stats;
    }

    @Override
    public void close() {
        stop(0);
    }
}
