package com.wangbin.exporter.core.transport.grpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.UnsignedLong;
import com.google.protobuf.ByteString;
import com.wangbin.exporter.common.domain.enums.SubscribeMode;
import com.wangbin.exporter.common.domain.enums.ValueEncoding;
import com.wangbin.exporter.common.exception.TransportException;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import com.wangbin.exporter.core.gnmi.model.TelemetryNotification;
import com.wangbin.exporter.core.gnmi.model.TelemetryUpdate;
import com.wangbin.exporter.core.gnmi.proto.Gnmi;
import com.wangbin.exporter.core.gnmi.proto.gNMIGrpc;
import com.wangbin.exporter.core.transport.TelemetryStream;
import com.wangbin.exporter.core.transport.model.PathSubscription;
import com.wangbin.exporter.core.transport.model.StreamEvent;
import com.wangbin.exporter.core.transport.model.SubscriptionRequest;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GrpcGnmiTransportTest {

    private final FakeGnmiService service = new FakeGnmiService();
    private String serverName;
    private Server server;
    private GrpcGnmiTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName).directExecutor().addService(service).build().start();
        transport = new GrpcGnmiTransport("spine-1",
                InProcessChannelBuilder.forName(serverName).directExecutor().build(),
                new JsonValueFlattener(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        transport.close();
        server.shutdownNow();
    }

    @Test
    void subscribeSendsStreamRequestAndDeliversEvents() throws Exception {
        service.responses.add(Gnmi.SubscribeResponse.newBuilder().setUpdate(Gnmi.Notification.newBuilder()
                .setTimestamp(1_700_000_000_000_000_000L)
                .setPrefix(path("interfaces", "interface", "eth0", "state"))
                .addUpdate(Gnmi.Update.newBuilder()
                        .setPath(Gnmi.Path.newBuilder()
                                .addElem(Gnmi.PathElem.newBuilder().setName("counters"))
                                .addElem(Gnmi.PathElem.newBuilder().setName("in-octets")))
                        .setVal(Gnmi.TypedValue.newBuilder().setUintVal(100)))
                .addUpdate(Gnmi.Update.newBuilder()
                        .setPath(Gnmi.Path.getDefaultInstance())
                        .setVal(Gnmi.TypedValue.newBuilder().setJsonIetfVal(ByteString.copyFrom(
                                "{\"openconfig-interfaces:mtu\":1500,\"description\":\"uplink\"}",
                                StandardCharsets.UTF_8)))))
                .build());
        service.responses.add(Gnmi.SubscribeResponse.newBuilder().setSyncResponse(true).build());

        TelemetryStream stream = transport.subscribe(request(null));

        StreamEvent first = stream.next(5, TimeUnit.SECONDS);
        assertEquals(StreamEvent.Kind.NOTIFICATION, first.kind());
        TelemetryNotification notification = first.notification();
        assertEquals(3, notification.updates().size());
        TelemetryUpdate counter = notification.updates().get(0);
        assertEquals(SchemaPath.parse("/interfaces/interface[name=eth0]/state/counters/in-octets"), counter.path());
        assertEquals(UnsignedLong.valueOf(100), counter.value());
        assertEquals(1_700_000_000_000L, counter.timestampMillis());
        assertEquals(SchemaPath.parse("/interfaces/interface[name=eth0]/state/mtu"), notification.updates().get(1).path());
        assertEquals(1500L, notification.updates().get(1).value());
        assertEquals("uplink", notification.updates().get(2).value());

        assertEquals(StreamEvent.Kind.SYNC_RESPONSE, stream.next(5, TimeUnit.SECONDS).kind());

        Gnmi.SubscriptionList sent = service.requests.get(0).getSubscribe();
        assertEquals(Gnmi.SubscriptionList.Mode.STREAM, sent.getMode());
        assertEquals(Gnmi.Encoding.PROTO, sent.getEncoding());
        assertEquals(1, sent.getSubscriptionCount());
        Gnmi.Subscription subscription = sent.getSubscription(0);
        assertEquals("openconfig", subscription.getPath().getOrigin());
        assertEquals(Gnmi.SubscriptionMode.SAMPLE, subscription.getMode());
        assertEquals(Duration.ofSeconds(30).toNanos(), subscription.getSampleInterval());

        stream.close();
        assertEquals(StreamEvent.Kind.COMPLETED, stream.next(5, TimeUnit.SECONDS).kind());
        assertTrue(service.cancelled.await(5, TimeUnit.SECONDS));
    }

    @Test
    void forcedEncodingWins() throws Exception {
        TelemetryStream stream = transport.subscribe(request(ValueEncoding.JSON_IETF));
        awaitRequest();
        stream.close();

        assertEquals(Gnmi.Encoding.JSON_IETF, service.requests.get(0).getSubscribe().getEncoding());
    }

    @Test
    void onChangeSubscriptionCarriesHeartbeat() {
        SubscriptionRequest request = SubscriptionRequest.builder()
                .targetName("spine-1")
                .address("in-process")
                .port(9339)
                .path(new PathSubscription(SchemaPath.parse("/interfaces/interface/state"), "openconfig"))
                .mode(SubscribeMode.ON_CHANGE)
                .heartbeatInterval(Duration.ofSeconds(30))
                .build();

        Gnmi.Subscription subscription = transport.buildSubscribeRequest(request, ValueEncoding.PROTO)
                .getSubscribe().getSubscription(0);

        assertEquals(Gnmi.SubscriptionMode.ON_CHANGE, subscription.getMode());
        assertEquals(Duration.ofSeconds(30).toNanos(), subscription.getHeartbeatInterval());
        assertEquals(0L, subscription.getSampleInterval());
    }

    @Test
    void sampleSubscriptionHasNoHeartbeat() {
        Gnmi.Subscription subscription = transport.buildSubscribeRequest(request(null), ValueEncoding.PROTO)
                .getSubscribe().getSubscription(0);

        assertEquals(Gnmi.SubscriptionMode.SAMPLE, subscription.getMode());
        assertEquals(0L, subscription.getHeartbeatInterval());
    }

    @Test
    void serverClosingStreamCompletesIt() throws Exception {
        service.completeAfterResponses = true;

        TelemetryStream stream = transport.subscribe(request(null));

        assertEquals(StreamEvent.Kind.COMPLETED, stream.next(5, TimeUnit.SECONDS).kind());
    }

    @Test
    void emptyResponseIsMalformed() throws Exception {
        service.responses.add(Gnmi.SubscribeResponse.getDefaultInstance());
        service.responses.add(Gnmi.SubscribeResponse.newBuilder().setSyncResponse(true).build());

        TelemetryStream stream = transport.subscribe(request(null));

        assertEquals(StreamEvent.Kind.MALFORMED, stream.next(5, TimeUnit.SECONDS).kind());
        assertEquals(StreamEvent.Kind.SYNC_RESPONSE, stream.next(5, TimeUnit.SECONDS).kind());
        stream.close();
    }

    @Test
    void missingDataModelFailsBeforeSubscribing() {
        SubscriptionRequest request = SubscriptionRequest.builder()
                .targetName("spine-1")
                .address("in-process")
                .port(9339)
                .path(new PathSubscription(SchemaPath.parse("/network-instances"), "openconfig"))
                .mode(SubscribeMode.SAMPLE)
                .sampleInterval(Duration.ofSeconds(30))
                .dataModel("openconfig-network-instance")
                .build();

        assertThrows(TransportException.class, () -> transport.subscribe(request));
        assertTrue(service.requests.isEmpty());
    }

    @Test
    void capabilitiesFailureIsTransportError() {
        service.capabilitiesError = Status.UNAVAILABLE;

        TransportException e = assertThrows(TransportException.class, () -> transport.subscribe(request(null)));
        assertTrue(e.getMessage().contains("UNAVAILABLE"));
    }

    @Test
    void encodingFallsBackToJson() {
        Gnmi.CapabilityResponse onlyBytes = Gnmi.CapabilityResponse.newBuilder()
                .addSupportedEncodings(Gnmi.Encoding.BYTES)
                .build();
        Gnmi.CapabilityResponse ietf = Gnmi.CapabilityResponse.newBuilder()
                .addSupportedEncodings(Gnmi.Encoding.ASCII)
                .addSupportedEncodings(Gnmi.Encoding.JSON_IETF)
                .build();

        assertEquals(ValueEncoding.JSON, GrpcGnmiTransport.selectEncoding(onlyBytes, null));
        assertEquals(ValueEncoding.JSON_IETF, GrpcGnmiTransport.selectEncoding(ietf, null));
    }

    private void awaitRequest() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (service.requests.isEmpty()) {
            if (System.currentTimeMillis() > deadline) {
                fail("subscribe request not received");
            }
            Thread.sleep(10);
        }
    }

    private static SubscriptionRequest request(ValueEncoding forced) {
        return SubscriptionRequest.builder()
                .targetName("spine-1")
                .address("in-process")
                .port(9339)
                .path(new PathSubscription(SchemaPath.parse("/interfaces/interface/state"), "openconfig"))
                .mode(SubscribeMode.SAMPLE)
                .sampleInterval(Duration.ofSeconds(30))
                .forceEncoding(forced)
                .dataModel("openconfig-interfaces")
                .rpcTimeout(Duration.ofSeconds(5))
                .build();
    }

    private static Gnmi.Path path(String container, String list, String name, String leaf) {
        return Gnmi.Path.newBuilder()
                .addElem(Gnmi.PathElem.newBuilder().setName(container))
                .addElem(Gnmi.PathElem.newBuilder().setName(list).putKey("name", name))
                .addElem(Gnmi.PathElem.newBuilder().setName(leaf))
                .build();
    }

    static class FakeGnmiService extends gNMIGrpc.gNMIImplBase {

        final List<Gnmi.SubscribeRequest> requests = new CopyOnWriteArrayList<>();
        final List<Gnmi.SubscribeResponse> responses = new CopyOnWriteArrayList<>();
        final CountDownLatch cancelled = new CountDownLatch(1);
        volatile boolean completeAfterResponses = false;
        volatile Status capabilitiesError;

        @Override
        public void capabilities(Gnmi.CapabilityRequest request, StreamObserver<Gnmi.CapabilityResponse> observer) {
            if (capabilitiesError != null) {
                observer.onError(capabilitiesError.asRuntimeException());
                return;
            }
            observer.onNext(Gnmi.CapabilityResponse.newBuilder()
                    .addSupportedModels(Gnmi.ModelData.newBuilder().setName("openconfig-interfaces"))
                    .addSupportedEncodings(Gnmi.Encoding.JSON_IETF)
                    .addSupportedEncodings(Gnmi.Encoding.PROTO)
                    .setGnmiVersion("0.10.0")
                    .build());
            observer.onCompleted();
        }

        @Override
        public StreamObserver<Gnmi.SubscribeRequest> subscribe(StreamObserver<Gnmi.SubscribeResponse> observer) {
            return new StreamObserver<>() {
                @Override
                public void onNext(Gnmi.SubscribeRequest request) {
                    requests.add(request);
                    for (Gnmi.SubscribeResponse response : responses) {
                        observer.onNext(response);
                    }
                    if (completeAfterResponses) {
                        observer.onCompleted();
                    }
                }

                @Override
                public void onError(Throwable t) {
                    cancelled.countDown();
                }

                @Override
                public void onCompleted() {
                    observer.onCompleted();
                }
            };
        }
    }
}
