package io.plinth.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.plinth.core.plan.NodeInstance;
import io.plinth.core.plan.RelationshipInstance;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `NodeInstance` in the format the file store keeps on disk.
///
/// ```
/// {
///   "id": "web_server_1",
///   "node_id": "web_server",
///   "state": "started",
///   "runtime_properties": {"ip": "10.0.0.1"},
///   "version": 3,
///   "relationships": [{"type": "...", "target_id": "database_1", "target_name": "database"}]
/// }
/// ```
///
/// @implNote Package-private. Registered by {@link PlinthJacksonModule}.
/// @see NodeInstanceDeserializer for the inverse operation
class NodeInstanceSerializer extends StdSerializer<NodeInstance> {

    @Serial private static final long serialVersionUID = 8850391460251340217L;

    NodeInstanceSerializer() {
        super(NodeInstance.class);
    }

    @Override
    public void serialize(NodeInstance instance, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", instance.getId());
        gen.writeStringField("node_id", instance.getNodeId());
        if (instance.getState() != null) {
            gen.writeStringField("state", instance.getState());
        } else {
            gen.writeNullField("state");
        }
        provider.defaultSerializeField("runtime_properties", instance.getRuntimeProperties(), gen);
        gen.writeNumberField("version", instance.getVersion());
        gen.writeArrayFieldStart("relationships");
        for (RelationshipInstance relationship : instance.getRelationships()) {
            gen.writeStartObject();
            gen.writeStringField("type", relationship.type());
            gen.writeStringField("target_id", relationship.targetId());
            if (relationship.targetName() != null) {
                gen.writeStringField("target_name", relationship.targetName());
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
