package work.lcod.pyson.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.pyson.codec.DocumentCodec;
import work.lcod.pyson.error.PysonError;
import work.lcod.pyson.error.PysonException;
import work.lcod.pyson.model.NamedValue;
import work.lcod.pyson.model.PysonValue;

/**
 * JSON views of pyson documents, used by the CLI.
 */
public final class PysonJson {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();

    private PysonJson() {}

    /** Array of {@code {"name", "type", "value"}} objects in document order. */
    public static String toJson(List<NamedValue> entries) {
        Objects.requireNonNull(entries, "entries");
        ArrayNode array = JSON.createArrayNode();
        for (NamedValue entry : entries) {
            ObjectNode node = array.addObject();
            node.put("name", entry.name());
            node.put("type", entry.type().tag());
            node.set("value", toNode(entry.value()));
        }
        return write(array);
    }

    /** Object mapping each name to its value. */
    public static String toJsonObject(Map<String, PysonValue> values) {
        Objects.requireNonNull(values, "values");
        ObjectNode object = JSON.createObjectNode();
        values.forEach((name, value) -> object.set(name, toNode(value)));
        return write(object);
    }

    /**
     * Builds a document from a flat JSON object. Member values are classified like any untyped
     * payload, so {@code 2.0} becomes an int.
     */
    public static List<NamedValue> fromJson(String json) {
        Objects.requireNonNull(json, "json");
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new PysonException(PysonError.INVALID_ARGUMENT, "Invalid JSON: " + ex.getOriginalMessage(), null, ex);
        }
        if (root == null || !root.isObject()) {
            throw new PysonException(PysonError.INVALID_ARGUMENT, "JSON payload must be an object", null);
        }
        List<NamedValue> entries = new ArrayList<>();
        var fields = root.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            entries.add(NamedValue.of(field.getKey(), PysonValue.of(toPayload(field.getValue()))));
        }
        DocumentCodec.requireUniqueNames(entries);
        return entries;
    }

    private static JsonNode toNode(PysonValue value) {
        if (value instanceof PysonValue.IntValue i) {
            return JSON.getNodeFactory().numberNode(i.value());
        }
        if (value instanceof PysonValue.FloatValue f) {
            return Double.isFinite(f.value())
                ? JSON.getNodeFactory().numberNode(f.value())
                : JSON.getNodeFactory().textNode(f.content());
        }
        if (value instanceof PysonValue.StrValue s) {
            return JSON.getNodeFactory().textNode(s.value());
        }
        ArrayNode array = JSON.createArrayNode();
        ((PysonValue.ListValue) value).elements().forEach(array::add);
        return array;
    }

    private static Object toPayload(JsonNode node) {
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new PysonException(PysonError.INVALID_NUMBER, "Integer out of range: " + node.asText(), node.asText());
            }
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>();
            node.forEach(item -> items.add(item.isTextual() ? item.textValue() : item));
            return items;
        }
        return node;
    }

    private static String write(JsonNode node) {
        try {
            return JSON_WRITER.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize JSON: " + ex.getOriginalMessage(), ex);
        }
    }
}
