package io.plinth.serialization;

import static io.plinth.serialization.JsonTrees.OBJECT_MAP;
import static io.plinth.serialization.JsonTrees.STRING_LIST;
import static io.plinth.serialization.JsonTrees.elements;
import static io.plinth.serialization.JsonTrees.readOperations;
import static io.plinth.serialization.JsonTrees.readValue;
import static io.plinth.serialization.JsonTrees.requiredText;
import static io.plinth.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.Relationship;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Deserializes a `Node` from the compiled plan format.
///
/// The node id is read from `"id"`, falling back to `"name"`. Missing collections
/// (`relationships`, `operations`, `source_operations`, ...) read as empty.
///
/// @implNote Package-private. Registered by {@link PlinthJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = 2248170950236417364L;

    NodeDeserializer() {
        super(Node.class);
    }

    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = textOrNull(root, "id");
        if (id == null) {
            id = requiredText(root, "name", "node");
        }

        List<Relationship> relationships = new ArrayList<>();
        for (JsonNode relationship : elements(root, "relationships")) {
            relationships.add(deserializeRelationship(mapper, relationship, id));
        }

        return Node.builder()
                .id(id)
                .type(textOrNull(root, "type"))
                .typeHierarchy(readValue(mapper, root, "type_hierarchy", STRING_LIST, List.of()))
                .properties(readValue(mapper, root, "properties", OBJECT_MAP, Map.of()))
                .operations(readOperations(mapper, root, "operations"))
                .relationships(relationships)
                .build();
    }

    private Relationship deserializeRelationship(ObjectMapper mapper, JsonNode root, String nodeId)
            throws IOException {
        return Relationship.builder()
                .type(textOrNull(root, "type"))
                .targetId(requiredText(root, "target_id", "relationship of node '" + nodeId + "'"))
                .typeHierarchy(readValue(mapper, root, "type_hierarchy", STRING_LIST, List.of()))
                .properties(readValue(mapper, root, "properties", OBJECT_MAP, Map.of()))
                .sourceOperations(readOperations(mapper, root, "source_operations"))
                .targetOperations(readOperations(mapper, root, "target_operations"))
                .build();
    }
}
