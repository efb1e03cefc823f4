package com.wangbin.exporter.core.manager.model;

import com.wangbin.exporter.common.domain.enums.MatchMode;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 目标上的一个插件绑定
 */
@Getter
@Builder
@ToString
public class PluginBinding {

    private final String type;

    /**
     * 覆盖插件声明的路径，为空时使用插件默认路径
     */
    @Singular
    private final List<SchemaPath> paths;

    @Builder.Default
    private final MatchMode match = MatchMode.PREFIX;

    @Singular
    private final Map<String, String> options;
}
