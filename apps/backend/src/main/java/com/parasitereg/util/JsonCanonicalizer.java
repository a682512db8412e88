package com.parasitereg.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 键排序的规范 JSON：同样的内容无论字段插入顺序如何，都序列化为同一个字符串。
 */
public final class JsonCanonicalizer {
    private JsonCanonicalizer() {}

    public static JsonNode normalize(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull()) return NullNode.getInstance();

        if (node.isObject()) {
            ObjectNode dst = mapper.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            Collections.sort(fields);
            for (String f : fields) {
                dst.set(f, normalize(mapper, node.get(f)));
            }
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = mapper.createArrayNode();
            for (JsonNode it : node) arr.add(normalize(mapper, it));
            return arr;
        }
        return node; // 值类型
    }

    public static String canonicalize(ObjectMapper mapper, JsonNode node) {
        try {
            return mapper.writeValueAsString(normalize(mapper, node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot canonicalize json", e);
        }
    }
}
