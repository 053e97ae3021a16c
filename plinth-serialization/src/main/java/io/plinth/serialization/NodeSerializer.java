package io.plinth.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.OperationDescriptor;
import io.plinth.core.plan.Relationship;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `Node` with its operations and relationships.
///
/// ```
/// Object          Fields
/// ————————————————+——————————————————————————————————————————————————————————————
/// node            │ id, type, type_hierarchy, properties, operations, relationships
/// relationship    │ type, target_id, type_hierarchy, properties,
///                 │ source_operations, target_operations
/// operation       │ operation, plugin, inputs
/// ```
///
/// @implNote Package-private. Registered by {@link PlinthJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = -6018850245411872231L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        writeIfNotNull(gen, "type", node.getType());
        provider.defaultSerializeField("type_hierarchy", node.getTypeHierarchy(), gen);
        provider.defaultSerializeField("properties", node.getProperties(), gen);
        writeOperations(gen, provider, "operations", node.getOperations());
        gen.writeArrayFieldStart("relationships");
        for (Relationship relationship : node.getRelationships()) {
            writeRelationship(relationship, gen, provider);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private void writeRelationship(
            Relationship relationship, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        writeIfNotNull(gen, "type", relationship.getType());
        writeIfNotNull(gen, "target_id", relationship.getTargetId());
        provider.defaultSerializeField("type_hierarchy", relationship.getTypeHierarchy(), gen);
        provider.defaultSerializeField("properties", relationship.getProperties(), gen);
        writeOperations(gen, provider, "source_operations", relationship.getSourceOperations());
        writeOperations(gen, provider, "target_operations", relationship.getTargetOperations());
        gen.writeEndObject();
    }

    static void writeOperations(
            JsonGenerator gen,
            SerializerProvider provider,
            String field,
            Map<String, OperationDescriptor> operations)
            throws IOException {
        gen.writeObjectFieldStart(field);
        for (Map.Entry<String, OperationDescriptor> entry : operations.entrySet()) {
            gen.writeFieldName(entry.getKey());
            writeOperation(gen, provider, entry.getValue());
        }
        gen.writeEndObject();
    }

    static void writeOperation(
            JsonGenerator gen, SerializerProvider provider, OperationDescriptor descriptor)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("operation", descriptor.operation());
        writeIfNotNull(gen, "plugin", descriptor.plugin());
        if (!descriptor.inputs().isEmpty()) {
            provider.defaultSerializeField("inputs", descriptor.inputs(), gen);
        }
        gen.writeEndObject();
    }

    private static void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
