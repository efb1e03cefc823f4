package com.wangbin.exporter.core.transport.model;

import com.wangbin.exporter.core.gnmi.model.SchemaPath;

/**
 * 单条订阅路径
 *
 * @param origin 路径所属的模型来源，例如 openconfig，可以为空
 */
public record PathSubscription(SchemaPath path, String origin) {

    public PathSubscription {
        origin = origin == null ? "" : origin;
    }
}
