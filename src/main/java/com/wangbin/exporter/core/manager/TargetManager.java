package com.wangbin.exporter.core.manager;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.core.config.ExporterProperties;
import com.wangbin.exporter.core.dispatch.OverflowStrategy;
import com.wangbin.exporter.core.dispatch.PluginDispatcher;
import com.wangbin.exporter.core.dispatch.PluginWorker;
import com.wangbin.exporter.core.manager.model.PluginBinding;
import com.wangbin.exporter.core.manager.model.Target;
import com.wangbin.exporter.core.plugin.base.PluginContext;
import com.wangbin.exporter.core.plugin.base.TelemetryPlugin;
import com.wangbin.exporter.core.plugin.factory.PluginFactory;
import com.wangbin.exporter.core.session.BackoffPolicy;
import com.wangbin.exporter.core.session.SessionSettings;
import com.wangbin.exporter.core.session.SubscriptionSession;
import com.wangbin.exporter.core.store.manager.MetricStore;
import com.wangbin.exporter.core.store.model.EvictionMode;
import com.wangbin.exporter.core.transport.TransportFactory;
import com.wangbin.exporter.core.transport.model.PathSubscription;
import com.wangbin.exporter.core.transport.model.SubscriptionRequest;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadFactory;

/**
 * 目标管理器：每个目标一个订阅会话线程，会话之间互不影响。
 */
@Slf4j
@Component
public class TargetManager {

    private final ExporterProperties properties;
    private final MetricStore metricStore;
    private final TransportFactory transportFactory;
    private final PluginFactory pluginFactory;
    private final TargetConfigResolver configResolver;

    private final ThreadFactory sessionThreadFactory = new ThreadFactoryBuilder()
            .setNameFormat("gnmi-session-%d")
            .setDaemon(true)
            .build();

    private final Map<String, ManagedSession> sessions = Collections.synchronizedMap(new LinkedHashMap<>());

    public TargetManager(ExporterProperties properties,
                         MetricStore metricStore,
                         TransportFactory transportFactory,
                         PluginFactory pluginFactory,
                         TargetConfigResolver configResolver) {
        this.properties = properties;
        this.metricStore = metricStore;
        this.transportFactory = transportFactory;
        this.pluginFactory = pluginFactory;
        this.configResolver = configResolver;
    }

    @PostConstruct
    public void init() {
        log.info("初始化目标管理器...");
        List<Target> targets = configResolver.resolve(properties);
        start(targets);
        log.info("目标管理器初始化完成，共 {} 个目标", targets.size());
    }

    /**
     * 为每个目标启动一个会话线程，立即返回
     */
    public synchronized void start(List<Target> targets) {
        for (Target target : targets) {
            if (sessions.containsKey(target.getName())) {
                log.warn("目标已在运行，跳过: {}", target.getName());
                continue;
            }
            SubscriptionSession session = createSession(target);
            Thread thread = sessionThreadFactory.newThread(session);
            thread.setName("gnmi-session-" + target.getName());
            sessions.put(target.getName(), new ManagedSession(target, session, thread));
            thread.start();
        }
    }

    SubscriptionSession createSession(Target target) {
        List<PluginWorker> workers = new ArrayList<>();
        ExporterProperties.DispatchConfig dispatch = properties.getDispatch();
        OverflowStrategy strategy = OverflowStrategy.from(dispatch.getOverflowStrategy());
        for (PluginBinding binding : target.getPlugins()) {
            TelemetryPlugin plugin = pluginFactory.createPlugin(PluginContext.builder()
                    .instanceName(properties.getInstanceName())
                    .targetName(target.getName())
                    .metricPrefix(properties.getMetricPrefix())
                    .pluginType(binding.getType())
                    .paths(binding.getPaths())
                    .matchMode(binding.getMatch())
                    .options(binding.getOptions())
                    .trackingTtl(properties.getStore().getStalenessThreshold())
                    .build());
            workers.add(new PluginWorker(target.getName(), plugin, metricStore,
                    dispatch.getQueueCapacity(), dispatch.getBatchSize(), strategy,
                    dispatch.getOfferTimeout().toMillis()));
        }
        PluginDispatcher dispatcher = new PluginDispatcher(target.getName(), workers);

        return new SubscriptionSession(buildRequest(target, dispatcher.getPlugins()), transportFactory,
                dispatcher, metricStore, BackoffPolicy.from(properties.getSession()),
                SessionSettings.from(properties));
    }

    /**
     * 订阅请求携带全部插件路径的并集
     */
    SubscriptionRequest buildRequest(Target target, List<TelemetryPlugin> plugins) {
        Set<PathSubscription> paths = new LinkedHashSet<>();
        Set<String> dataModels = new LinkedHashSet<>();
        for (TelemetryPlugin plugin : plugins) {
            paths.addAll(plugin.getSubscribedPaths());
            dataModels.addAll(plugin.getDataModels());
        }
        return SubscriptionRequest.builder()
                .targetName(target.getName())
                .address(target.getAddress())
                .port(target.getPort())
                .tls(target.isTls())
                .paths(paths)
                .mode(target.getMode())
                .sampleInterval(target.getSampleInterval())
                // ON_CHANGE 按采样间隔请求心跳，静默的设备也会定期刷新指标并喂狗
                .heartbeatInterval(target.getMode() == SubscribeMode.ON_CHANGE ? target.getSampleInterval() : null)
                .forceEncoding(target.getForceEncoding())
                .dataModels(dataModels)
                .rpcTimeout(properties.getSession().getRpcTimeout())
                .build();
    }

    @PreDestroy
    public void destroy() {
        stop(properties.getSession().getStopTimeout());
    }

    /**
     * 通知全部会话停止并等待，超时后强制中断
     */
    public synchronized void stop(Duration timeout) {
        List<ManagedSession> running;
        synchronized (sessions) {
            running = new ArrayList<>(sessions.values());
        }
        if (running.isEmpty()) {
            return;
        }
        log.info("停止全部订阅会话: count={}, timeout={}", running.size(), timeout);
        for (ManagedSession managed : running) {
            managed.session().close();
        }

        long deadline = System.currentTimeMillis() + timeout.toMillis();
        for (ManagedSession managed : running) {
            long remaining = deadline - System.currentTimeMillis();
            try {
                if (remaining > 0) {
                    managed.thread().join(remaining);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (managed.thread().isAlive()) {
                log.warn("会话未在超时内退出，强制中断: {}", managed.target().getName());
                managed.thread().interrupt();
            }
            // 线程可能仍未退出，作废全部代次后再删除，迟到的写入会被丢弃
            managed.session().getDispatcher().retireAll();
            metricStore.evictTarget(managed.target().getName(), EvictionMode.REMOVE);
        }
        sessions.clear();
        log.info("全部订阅会话已停止");
    }

    public List<SubscriptionSession> getSessions() {
        List<SubscriptionSession> list = new ArrayList<>();
        synchronized (sessions) {
            for (ManagedSession managed : sessions.values()) {
                list.add(managed.session());
            }
        }
        return list;
    }

    public SubscriptionSession getSession(String targetName) {
        ManagedSession managed = sessions.get(targetName);
        return managed == null ? null : managed.session();
    }

    public int getConfiguredTargetCount() {
        return sessions.size();
    }

    private record ManagedSession(Target target, SubscriptionSession session, Thread thread) {
    }
}
