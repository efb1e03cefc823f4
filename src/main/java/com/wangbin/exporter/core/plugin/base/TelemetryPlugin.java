package com.wangbin.exporter.core.plugin.base;

import com.wangbin.exporter.common.domain.enums.MatchMode;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.transport.model.PathSubscription;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 遥测插件接口。
 * <p>
 * 每个（目标, 插件类型）一个实例，只会收到路径匹配其订阅路径的更新，
 * 所有回调都在该插件自己的工作线程上串行执行，内部状态无需加锁。
 * 处理过程中不允许阻塞 I/O。
 */
public interface TelemetryPlugin {

    /**
     * 插件类型，例如 oc_interfaces
     */
    String getType();

    /**
     * 订阅路径，用于生成订阅请求和分发路由
     */
    List<PathSubscription> getSubscribedPaths();

    /**
     * 要求设备支持的数据模型
     */
    Set<String> getDataModels();

    MatchMode getMatchMode();

    /**
     * 处理一个叶子更新
     *
     * @throws RuntimeException 值类型不符等处理错误，由分发边界捕获
     */
    PluginOutput process(TelemetryUpdate update);

    /**
     * 设备删除了一个路径
     */
    PluginOutput onDelete(SchemaPath path);

    /**
     * 同步状态变化，按流顺序到达。false 表示流已断开或重新建立，插件应清理派生状态
     */
    void onSyncStatusChanged(boolean synced);

    Map<String, Object> getStatistics();
}
