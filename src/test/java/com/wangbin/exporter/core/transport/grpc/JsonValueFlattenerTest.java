package com.wangbin.exporter.core.transport.grpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.UnsignedLong;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonValueFlattenerTest {

    private final JsonValueFlattener flattener = new JsonValueFlattener(new ObjectMapper());

    @Test
    void nestedObjectsBecomeLeafPaths() throws IOException {
        List<JsonValueFlattener.Leaf> leaves = flatten("/interfaces/interface[name=eth0]/state",
                "{\"openconfig-interfaces:counters\":{\"in-octets\":\"18446744073709551615\",\"out-octets\":42},"
                        + "\"enabled\":true,\"mtu\":null}");

        assertEquals(3, leaves.size());
        assertEquals(SchemaPath.parse("/interfaces/interface[name=eth0]/state/counters/in-octets"), leaves.get(0).path());
        assertEquals("18446744073709551615", leaves.get(0).value());
        assertEquals(42L, leaves.get(1).value());
        assertEquals(true, leaves.get(2).value());
    }

    @Test
    void listEntriesAreKeyedByWellKnownFields() throws IOException {
        List<JsonValueFlattener.Leaf> leaves = flatten("/interfaces",
                "{\"interface\":[{\"name\":\"eth0\",\"state\":{\"mtu\":1500}},{\"name\":\"eth1\",\"state\":{\"mtu\":9000}}]}");

        assertTrue(leaves.stream().anyMatch(leaf ->
                leaf.path().equals(SchemaPath.parse("/interfaces/interface[name=eth1]/state/mtu"))
                        && Long.valueOf(9000).equals(leaf.value())));
    }

    @Test
    void scalarArraysStayTogether() throws IOException {
        List<JsonValueFlattener.Leaf> leaves = flatten("/system/dns/state", "{\"search\":[\"a.example\",\"b.example\"]}");

        assertEquals(1, leaves.size());
        assertEquals(List.of("a.example", "b.example"), leaves.get(0).value());
    }

    @Test
    void bareScalarUsesBasePath() throws IOException {
        List<JsonValueFlattener.Leaf> leaves = flatten("/interfaces/interface[name=eth0]/state/counters/in-octets",
                "18446744073709551615");

        assertEquals(UnsignedLong.MAX_VALUE, leaves.get(0).value());
    }

    @Test
    void invalidJsonIsRejected() {
        assertThrows(IOException.class, () -> flatten("/system", "{\"broken\":"));
    }

    private List<JsonValueFlattener.Leaf> flatten(String base, String json) throws IOException {
        return flattener.flatten(SchemaPath.parse(base), json.getBytes(StandardCharsets.UTF_8));
    }
}
