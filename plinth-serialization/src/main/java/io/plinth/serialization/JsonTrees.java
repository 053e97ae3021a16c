package io.plinth.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.plinth.core.plan.OperationDescriptor;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Field extraction helpers shared by the tree-based deserializers.
///
/// Absent and explicit-null fields read the same way: as null scalars or empty collections.
final class JsonTrees {

    static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private JsonTrees() {}

    static String textOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static String requiredText(JsonNode root, String field, String owner) throws IOException {
        String value = textOrNull(root, field);
        if (value == null) {
            throw MismatchedInputException.from(
                    null, Object.class, "Missing required field '" + field + "' in " + owner);
        }
        return value;
    }

    static <T> T readValue(
            ObjectMapper mapper, JsonNode root, String field, TypeReference<T> typeRef, T empty)
            throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return empty;
        }
        return mapper.treeToValue(value, mapper.constructType(typeRef.getType()));
    }

    /// Reads an `operation name -> descriptor` map.
    ///
    /// A descriptor is either an object with `operation`, `plugin` and `inputs`, or a bare
    /// dotted path string.
    static Map<String, OperationDescriptor> readOperations(
            ObjectMapper mapper, JsonNode root, String field) throws IOException {
        Map<String, OperationDescriptor> operations = new LinkedHashMap<>();
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return operations;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            operations.put(entry.getKey(), readOperation(mapper, entry.getValue(), entry.getKey()));
        }
        return operations;
    }

    static OperationDescriptor readOperation(ObjectMapper mapper, JsonNode node, String name)
            throws IOException {
        if (node.isTextual()) {
            return OperationDescriptor.of(node.asText());
        }
        return new OperationDescriptor(
                requiredText(node, "operation", "operation '" + name + "'"),
                textOrNull(node, "plugin"),
                readValue(mapper, node, "inputs", OBJECT_MAP, Map.of()));
    }

    static List<JsonNode> elements(JsonNode root, String field) {
        List<JsonNode> elements = new ArrayList<>();
        JsonNode value = root.get(field);
        if (value != null && value.isArray()) {
            value.forEach(elements::add);
        }
        return elements;
    }
}
