package com.wangbin.exporter.core.transport.grpc;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedLong;
import com.wangbin.exporter.common.exception.MalformedMessageException;
import com.wangbin.exporter.core.gnmi.model.PathElement;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryNotification;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.gnmi.proto.Gnmi;
import com.wangbin.exporter.core.transport.model.PathSubscription;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * gNMI 协议消息与内部模型之间的转换
 */
public class GnmiMessageConverter {

    private final String targetName;
    private final JsonValueFlattener jsonFlattener;

    public GnmiMessageConverter(String targetName, JsonValueFlattener jsonFlattener) {
        this.targetName = targetName;
        this.jsonFlattener = jsonFlattener;
    }

    /**
     * 转换一条通知。设备时间戳为 0 时使用接收时间。
     *
     * @throws MalformedMessageException 路径或值无法转换
     */
    public TelemetryNotification toNotification(Gnmi.Notification notification, long receiptNanos) {
        long timestamp = notification.getTimestamp() > 0 ? notification.getTimestamp() : receiptNanos;
        SchemaPath prefix = toSchemaPath(notification.getPrefix());

        List<TelemetryUpdate> updates = new ArrayList<>(notification.getUpdateCount());
        for (Gnmi.Update update : notification.getUpdateList()) {
            SchemaPath path = prefix.concat(toSchemaPath(update.getPath()));
            Gnmi.TypedValue value = update.getVal();
            switch (value.getValueCase()) {
                case JSON_VAL -> flattenJson(path, value.getJsonVal().toByteArray(), timestamp, updates);
                case JSON_IETF_VAL -> flattenJson(path, value.getJsonIetfVal().toByteArray(), timestamp, updates);
                default -> updates.add(new TelemetryUpdate(path, toValue(value, path), timestamp));
            }
        }

        List<SchemaPath> deletes = new ArrayList<>(notification.getDeleteCount());
        for (Gnmi.Path delete : notification.getDeleteList()) {
            deletes.add(prefix.concat(toSchemaPath(delete)));
        }
        return new TelemetryNotification(timestamp, updates, deletes, notification.getAtomic());
    }

    public SchemaPath toSchemaPath(Gnmi.Path path) {
        if (path == null || path.getElemCount() == 0) {
            return SchemaPath.ROOT;
        }
        List<PathElement> elements = new ArrayList<>(path.getElemCount());
        for (Gnmi.PathElem elem : path.getElemList()) {
            if (elem.getName().isEmpty()) {
                throw new MalformedMessageException("路径元素名称为空", targetName, path.toString());
            }
            elements.add(PathElement.of(elem.getName(), elem.getKeyMap()));
        }
        return SchemaPath.of(elements);
    }

    public Gnmi.Path toProtoPath(PathSubscription subscription) {
        Gnmi.Path.Builder builder = Gnmi.Path.newBuilder().setOrigin(subscription.origin());
        for (PathElement element : subscription.path().elements()) {
            builder.addElem(Gnmi.PathElem.newBuilder()
                    .setName(element.name())
                    .putAllKey(element.keys())
                    .build());
        }
        return builder.build();
    }

    Object toValue(Gnmi.TypedValue value, SchemaPath path) {
        switch (value.getValueCase()) {
            case STRING_VAL:
                return value.getStringVal();
            case ASCII_VAL:
                return value.getAsciiVal();
            case INT_VAL:
                return value.getIntVal();
            case UINT_VAL:
                return UnsignedLong.fromLongBits(value.getUintVal());
            case BOOL_VAL:
                return value.getBoolVal();
            case FLOAT_VAL:
                return (double) value.getFloatVal();
            case DOUBLE_VAL:
                return value.getDoubleVal();
            case DECIMAL_VAL:
                Gnmi.Decimal64 decimal = value.getDecimalVal();
                return BigDecimal.valueOf(decimal.getDigits(), decimal.getPrecision()).doubleValue();
            case BYTES_VAL:
                return BaseEncoding.base64().encode(value.getBytesVal().toByteArray());
            case LEAFLIST_VAL:
                List<Object> elements = new ArrayList<>();
                for (Gnmi.TypedValue element : value.getLeaflistVal().getElementList()) {
                    elements.add(toValue(element, path));
                }
                return elements;
            default:
                throw new MalformedMessageException("不支持的值类型: " + value.getValueCase(),
                        targetName, path.toString());
        }
    }

    private void flattenJson(SchemaPath path, byte[] json, long timestamp, List<TelemetryUpdate> updates) {
        try {
            for (JsonValueFlattener.Leaf leaf : jsonFlattener.flatten(path, json)) {
                updates.add(new TelemetryUpdate(leaf.path(), leaf.value(), timestamp));
            }
        } catch (IOException e) {
            throw new MalformedMessageException("JSON 值解析失败", targetName, path.toString(), e);
        }
    }
}
