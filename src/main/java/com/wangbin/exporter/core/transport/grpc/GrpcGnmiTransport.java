package com.wangbin.exporter.core.transport.grpc;

import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.domain.enums.ValueEncoding;
import com.wangbin.exporter.common.exception.TransportException;
import com.wangbin.exporter.core.gnmi.proto.Gnmi;
import com.wangbin.exporter.core.gnmi.proto.gNMIGrpc;
import com.wangbin.exporter.core.transport.TelemetryStream;
import com.wangbin.exporter.core.transport.TelemetryTransport;
import com.wangbin.exporter.core.transport.model.PathSubscription;
import com.wangbin.exporter.core.transport.model.SubscriptionRequest;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 基于 grpc-java 的 gNMI 传输实现
 */
@Slf4j
public class GrpcGnmiTransport implements TelemetryTransport {

    private final String targetName;
    private final ManagedChannel channel;
    private final GnmiMessageConverter converter;

    public GrpcGnmiTransport(String targetName, ManagedChannel channel, JsonValueFlattener jsonFlattener) {
        this.targetName = targetName;
        this.channel = channel;
        this.converter = new GnmiMessageConverter(targetName, jsonFlattener);
    }

    @Override
    public TelemetryStream subscribe(SubscriptionRequest request) throws TransportException {
        Gnmi.CapabilityResponse capabilities = capabilities(request);
        checkDataModels(capabilities, request);
        ValueEncoding encoding = selectEncoding(capabilities, request.getForceEncoding());
        log.info("设备能力检查通过: target={}, gnmiVersion={}, encoding={}",
                targetName, capabilities.getGnmiVersion(), encoding);

        GnmiSubscribeStream stream = new GnmiSubscribeStream(targetName, converter);
        try {
            gNMIGrpc.newStub(channel).subscribe(stream);
            stream.send(buildSubscribeRequest(request, encoding));
        } catch (StatusRuntimeException e) {
            stream.close();
            throw new TransportException("订阅请求发送失败: " + e.getStatus(), targetName, e);
        }
        return stream;
    }

    Gnmi.CapabilityResponse capabilities(SubscriptionRequest request) throws TransportException {
        try {
            return gNMIGrpc.newBlockingStub(channel)
                    .withDeadlineAfter(request.getRpcTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .capabilities(Gnmi.CapabilityRequest.getDefaultInstance());
        } catch (StatusRuntimeException e) {
            throw new TransportException("Capabilities 调用失败: " + e.getStatus().getCode(), targetName, e);
        }
    }

    void checkDataModels(Gnmi.CapabilityResponse capabilities, SubscriptionRequest request)
            throws TransportException {
        Set<String> supported = new HashSet<>();
        for (Gnmi.ModelData model : capabilities.getSupportedModelsList()) {
            supported.add(model.getName());
        }
        for (String model : request.getDataModels()) {
            if (!supported.contains(model)) {
                throw new TransportException("设备不支持数据模型 " + model, targetName);
            }
        }
    }

    /**
     * 强制编码优先；否则按 PROTO、JSON、JSON_IETF、ASCII 的顺序取第一个设备支持的编码
     */
    static ValueEncoding selectEncoding(Gnmi.CapabilityResponse capabilities, ValueEncoding forced) {
        if (forced != null) {
            return forced;
        }
        List<Integer> supported = capabilities.getSupportedEncodingsValueList();
        for (ValueEncoding encoding : ValueEncoding.PREFERRED) {
            if (supported.contains(encoding.getNumber())) {
                return encoding;
            }
        }
        return ValueEncoding.JSON;
    }

    Gnmi.SubscribeRequest buildSubscribeRequest(SubscriptionRequest request, ValueEncoding encoding) {
        Gnmi.SubscriptionList.Builder list = Gnmi.SubscriptionList.newBuilder()
                .setMode(Gnmi.SubscriptionList.Mode.STREAM)
                .setEncodingValue(encoding.getNumber())
                .setAllowAggregation(false)
                .setUpdatesOnly(false);

        for (PathSubscription path : request.getPaths()) {
            Gnmi.Subscription.Builder subscription = Gnmi.Subscription.newBuilder()
                    .setPath(converter.toProtoPath(path))
                    .setSuppressRedundant(false);
            if (request.getMode() == SubscribeMode.ON_CHANGE) {
                subscription.setMode(Gnmi.SubscriptionMode.ON_CHANGE);
                if (request.hasHeartbeat()) {
                    subscription.setHeartbeatInterval(request.getHeartbeatInterval().toNanos());
                }
            } else {
                subscription.setMode(Gnmi.SubscriptionMode.SAMPLE)
                        .setSampleInterval(request.getSampleInterval().toNanos());
            }
            list.addSubscription(subscription.build());
        }
        return Gnmi.SubscribeRequest.newBuilder().setSubscribe(list.build()).build();
    }

    @Override
    public void close() {
        channel.shutdownNow();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("gRPC 通道未能在超时内关闭: target={}", targetName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
