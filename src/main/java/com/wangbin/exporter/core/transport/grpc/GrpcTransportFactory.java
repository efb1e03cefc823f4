package com.wangbin.exporter.core.transport.grpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.exporter.core.transport.TelemetryTransport;
import com.wangbin.exporter.core.transport.TransportFactory;
import com.wangbin.exporter.core.transport.model.SubscriptionRequest;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 为每次连接尝试创建新的 gRPC 通道
 */
@Slf4j
@Component
public class GrpcTransportFactory implements TransportFactory {

    private final JsonValueFlattener jsonFlattener;

    public GrpcTransportFactory(ObjectMapper objectMapper) {
        this.jsonFlattener = new JsonValueFlattener(objectMapper);
    }

    @Override
    public TelemetryTransport create(SubscriptionRequest request) {
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forAddress(request.getAddress(), request.getPort());
        if (request.isTls()) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        ManagedChannel channel = builder.build();
        log.debug("创建 gRPC 通道: target={}, endpoint={}, tls={}",
                request.getTargetName(), request.endpoint(), request.isTls());
        return new GrpcGnmiTransport(request.getTargetName(), channel, jsonFlattener);
    }
}
