package com.wangbin.exporter.core.transport.grpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.UnsignedLong;
import com.wangbin.exporter.core.gnmi.model.PathElement;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON / JSON_IETF 编码值展开。
 * <p>
 * 标量直接转换；对象按字段逐层展开为叶子路径，字段名上的模块前缀（module:name）会被去掉。
 * 对象数组视为 YANG 列表，取 name / index / id 字段作为列表键。
 */
public class JsonValueFlattener {

    private static final List<String> LIST_KEY_FIELDS = List.of("name", "index", "id");

    private final ObjectMapper objectMapper;

    public JsonValueFlattener(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 一个展开后的叶子
     */
    public record Leaf(SchemaPath path, Object value) {
    }

    public List<Leaf> flatten(SchemaPath base, byte[] json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        List<Leaf> leaves = new ArrayList<>();
        if (root == null || root.isMissingNode()) {
            return leaves;
        }
        walk(base, root, leaves);
        return leaves;
    }

    private void walk(SchemaPath path, JsonNode node, List<Leaf> leaves) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String name = stripModule(field.getKey());
                JsonNode child = field.getValue();
                if (child.isArray() && containsObjects(child)) {
                    for (JsonNode item : child) {
                        walk(path.append(PathElement.of(name, listKeys(item))), item, leaves);
                    }
                } else {
                    walk(path.append(PathElement.of(name)), child, leaves);
                }
            }
            return;
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonNode item : node) {
                Object value = scalar(item);
                if (value != null) {
                    values.add(value);
                }
            }
            leaves.add(new Leaf(path, values));
            return;
        }
        Object value = scalar(node);
        if (value != null) {
            leaves.add(new Leaf(path, value));
        }
    }

    private Map<String, String> listKeys(JsonNode item) {
        Map<String, String> keys = new LinkedHashMap<>();
        if (!item.isObject()) {
            return keys;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = stripModule(field.getKey());
            if (LIST_KEY_FIELDS.contains(name) && field.getValue().isValueNode()) {
                keys.put(name, field.getValue().asText());
            }
        }
        return keys;
    }

    private static boolean containsObjects(JsonNode array) {
        for (JsonNode item : array) {
            if (item.isObject()) {
                return true;
            }
        }
        return false;
    }

    static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            if (node.canConvertToLong()) {
                return node.longValue();
            }
            BigInteger big = node.bigIntegerValue();
            if (big.signum() >= 0 && big.bitLength() <= 64) {
                return UnsignedLong.valueOf(big);
            }
            return big.doubleValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    static String stripModule(String name) {
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }
}
