// file: src/main/java/io/reclite/core/RecordJson.java
package io.reclite.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Jackson bridge for {@link RecordValue}.
 * <p>
 * Number mapping:
 *  - integral JSON numbers that fit in a long become IntValue,
 *  - everything else (fractions, exponents, oversized integers) becomes FloatValue.
 */
public final class RecordJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RecordJson() {
        // utility
    }

    /** Shared mapper, configured to reject trailing garbage after the first JSON value. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parse JSON text that must be a single object.
     *
     * @throws InvalidInputException if the text is not valid JSON or not an object
     */
    public static RecordValue.ObjectValue parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidInputException("invalid JSON format: empty input");
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("invalid JSON format: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidInputException("invalid JSON format: expected an object, got "
                    + (node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT)));
        }
        return (RecordValue.ObjectValue) fromNode(node);
    }

    public static RecordValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return RecordValue.NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new RecordValue.TextValue(node.textValue());
        }
        if (node.isBoolean()) {
            return new RecordValue.BoolValue(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new RecordValue.IntValue(node.longValue());
        }
        if (node.isNumber()) {
            return new RecordValue.FloatValue(node.doubleValue());
        }
        if (node.isArray()) {
            List<RecordValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromNode(element));
            }
            return new RecordValue.ArrayValue(elements);
        }
        if (node.isObject()) {
            Map<String, RecordValue> fields = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                fields.put(e.getKey(), fromNode(e.getValue()));
            }
            return new RecordValue.ObjectValue(fields);
        }
        // binary and POJO nodes never come out of readTree on text input
        throw new InvalidInputException("unsupported JSON node type: " + node.getNodeType());
    }

    public static JsonNode toNode(RecordValue value) {
        if (value instanceof RecordValue.TextValue t) {
            return NODES.textNode(t.value());
        } else if (value instanceof RecordValue.IntValue i) {
            return NODES.numberNode(i.value());
        } else if (value instanceof RecordValue.FloatValue f) {
            return NODES.numberNode(f.value());
        } else if (value instanceof RecordValue.BoolValue b) {
            return NODES.booleanNode(b.value());
        } else if (value instanceof RecordValue.NullValue) {
            return NODES.nullNode();
        } else if (value instanceof RecordValue.ArrayValue a) {
            ArrayNode array = NODES.arrayNode(a.elements().size());
            for (RecordValue element : a.elements()) {
                array.add(toNode(element));
            }
            return array;
        } else if (value instanceof RecordValue.ObjectValue o) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<String, RecordValue> e : o.fields().entrySet()) {
                object.set(e.getKey(), toNode(e.getValue()));
            }
            return object;
        }
        throw new IllegalStateException("Unknown record value type: " + value);
    }

    /** Compact single-line JSON. */
    public static String render(RecordValue value) {
        try {
            return MAPPER.writeValueAsString(toNode(value));
        } catch (JsonProcessingException e) {
            // in-memory node trees always serialize
            throw new IllegalStateException("Failed to render record value", e);
        }
    }
}
