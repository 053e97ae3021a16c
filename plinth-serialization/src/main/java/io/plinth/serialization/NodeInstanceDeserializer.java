package io.plinth.serialization;

import static io.plinth.serialization.JsonTrees.OBJECT_MAP;
import static io.plinth.serialization.JsonTrees.elements;
import static io.plinth.serialization.JsonTrees.readValue;
import static io.plinth.serialization.JsonTrees.requiredText;
import static io.plinth.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.plinth.core.plan.NodeInstance;
import io.plinth.core.plan.RelationshipInstance;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Deserializes a `NodeInstance` from a stored file or a compiled plan.
///
/// Compiled plans name the owning node `"name"`; stored instances use `"node_id"`. Both are
/// accepted, `"node_id"` taking precedence. A missing `"state"` reads as
/// {@link NodeInstance#INITIAL_STATE} and a missing `"version"` as 0.
///
/// @implNote Package-private. Registered by {@link PlinthJacksonModule}.
/// @see NodeInstanceSerializer for the inverse operation
class NodeInstanceDeserializer extends StdDeserializer<NodeInstance> {

    @Serial private static final long serialVersionUID = -1455902813067725430L;

    NodeInstanceDeserializer() {
        super(NodeInstance.class);
    }

    @Override
    public NodeInstance deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = requiredText(root, "id", "node instance");
        String nodeId = textOrNull(root, "node_id");
        if (nodeId == null) {
            nodeId = requiredText(root, "name", "node instance '" + id + "'");
        }

        List<RelationshipInstance> relationships = new ArrayList<>();
        for (JsonNode relationship : elements(root, "relationships")) {
            relationships.add(
                    new RelationshipInstance(
                            requiredText(relationship, "type", "relationship of " + id),
                            requiredText(relationship, "target_id", "relationship of " + id),
                            textOrNull(relationship, "target_name")));
        }

        NodeInstance.Builder builder =
                NodeInstance.builder()
                        .id(id)
                        .nodeId(nodeId)
                        .runtimeProperties(
                                readValue(mapper, root, "runtime_properties", OBJECT_MAP, Map.of()))
                        .version(root.path("version").asLong(0))
                        .relationships(relationships);
        if (root.has("state")) {
            builder.state(textOrNull(root, "state"));
        }
        return builder.build();
    }
}
