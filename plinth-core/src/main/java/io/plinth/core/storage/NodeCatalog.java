package io.plinth.core.storage;

import io.plinth.core.exception.NotFoundException;
import io.plinth.core.plan.Node;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Read-only lookup of a plan's nodes by id, shared by the store backends.
///
/// Nodes are deeply immutable, so they are handed out as-is.
public final class NodeCatalog {

    private final Map<String, Node> nodes;

    public NodeCatalog(List<Node> nodes) {
        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node node : nodes) {
            byId.put(node.getId(), node);
        }
        this.nodes = Collections.unmodifiableMap(byId);
    }

    /// @throws NotFoundException if no node has the given id
    public Node get(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new NotFoundException("Node " + nodeId + " does not exist");
        }
        return node;
    }

    public List<Node> all() {
        return List.copyOf(nodes.values());
    }
}
