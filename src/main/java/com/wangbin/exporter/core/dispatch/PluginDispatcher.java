package com.wangbin.exporter.core.dispatch;

import com.wangbin.exporter.core.dispatch.model.DispatchItem;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryNotification;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.plugin.base.TelemetryPlugin;
import com.wangbin.exporter.core.transport.model.PathSubscription;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 目标级插件分发器：按路径把通知中的每个更新投递到对应插件的队列。
 * 只由该目标的会话线程调用，因此同一插件收到的更新保持设备发送顺序。
 */
@Slf4j
public class PluginDispatcher implements AutoCloseable {

    private final String targetName;
    private final List<PluginWorker> workers;
    private final DispatchTable<PluginWorker> table = new DispatchTable<>();

    private final AtomicLong dispatched = new AtomicLong(0);
    private final AtomicLong unrouted = new AtomicLong(0);

    public PluginDispatcher(String targetName, List<PluginWorker> workers) {
        this.targetName = targetName;
        this.workers = List.copyOf(workers);
        for (PluginWorker worker : this.workers) {
            TelemetryPlugin plugin = worker.getPlugin();
            for (PathSubscription subscription : plugin.getSubscribedPaths()) {
                table.register(subscription.path(), plugin.getMatchMode(), worker);
            }
        }
        log.info("插件路由表构建完成: target={}, plugins={}, routes={}", targetName, workers.size(), table.size());
    }

    public void start() {
        workers.forEach(PluginWorker::start);
    }

    public void stop(long timeoutMillis) {
        for (PluginWorker worker : workers) {
            worker.stop(timeoutMillis);
        }
    }

    public void dispatch(TelemetryNotification notification, long epoch, boolean synced) {
        for (TelemetryUpdate update : notification.updates()) {
            List<PluginWorker> targets = table.route(update.path());
            if (targets.isEmpty()) {
                unrouted.incrementAndGet();
                log.debug("没有插件订阅该路径: target={}, path={}", targetName, update.path());
                continue;
            }
            DispatchItem item = DispatchItem.update(update, epoch, synced);
            for (PluginWorker worker : targets) {
                worker.enqueue(item);
            }
            dispatched.incrementAndGet();
        }
        for (SchemaPath delete : notification.deletes()) {
            DispatchItem item = DispatchItem.delete(delete, epoch, synced);
            for (PluginWorker worker : table.routeOverlapping(delete)) {
                worker.enqueue(item);
            }
        }
    }

    /**
     * 向所有插件广播同步状态
     */
    public void signalSync(long epoch, boolean synced) {
        DispatchItem item = DispatchItem.sync(epoch, synced);
        for (PluginWorker worker : workers) {
            worker.enqueue(item);
        }
    }

    /**
     * 作废不大于 epoch 的代次，返回时所有插件都不会再写入这些代次的数据
     */
    public void retireEpoch(long epoch) {
        for (PluginWorker worker : workers) {
            worker.retireEpoch(epoch);
        }
    }

    /**
     * 作废全部代次，用于会话停止
     */
    public void retireAll() {
        retireEpoch(Long.MAX_VALUE);
    }

    public List<TelemetryPlugin> getPlugins() {
        List<TelemetryPlugin> plugins = new ArrayList<>(workers.size());
        for (PluginWorker worker : workers) {
            plugins.add(worker.getPlugin());
        }
        return Collections.unmodifiableList(plugins);
    }

    public long getPluginErrors() {
        long total = 0;
        for (PluginWorker worker : workers) {
            total += worker.getPluginErrors();
        }
        return total;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("dispatched", dispatched.get());
        stats.put("unrouted", unrouted.get());
        Map<String, Object> plugins = new LinkedHashMap<>();
        for (PluginWorker worker : workers) {
            plugins.put(worker.getPlugin().getType(), worker.getStatistics());
        }
        stats.put("plugins", plugins);
        return stats;
    }

    @Override
    public void close() {
        stop(0);
    }
}
