package io.plinth.serialization;

import static io.plinth.serialization.JsonTrees.OBJECT_MAP;
import static io.plinth.serialization.JsonTrees.elements;
import static io.plinth.serialization.JsonTrees.readOperation;
import static io.plinth.serialization.JsonTrees.readValue;
import static io.plinth.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.plinth.core.plan.DeploymentPlan;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.NodeInstance;
import io.plinth.core.plan.ParameterDefinition;
import io.plinth.core.plan.WorkflowDefinition;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes a compiled `DeploymentPlan`.
///
/// ```
/// {
///   "nodes": [ ... ],
///   "node_instances": [ ... ],
///   "workflows": {
///     "install": {"operation": "workflows.install", "plugin": "default_workflows",
///                 "parameters": {"x": {"default": 1, "description": "..."}}}
///   },
///   "outputs": {"endpoint": {"value": {"get_attribute": ["vm", "ip"]}}}
/// }
/// ```
///
/// A workflow parameter is optional exactly when its definition has a `"default"` key, even
/// when that default is null. Plan-level validation errors surface as
/// {@link io.plinth.core.exception.ConfigurationException} from {@link DeploymentPlan.Builder#build()}.
///
/// @implNote Package-private. Registered by {@link PlinthJacksonModule}.
class DeploymentPlanDeserializer extends StdDeserializer<DeploymentPlan> {

    @Serial private static final long serialVersionUID = -7933126079120534188L;

    DeploymentPlanDeserializer() {
        super(DeploymentPlan.class);
    }

    @Override
    public DeploymentPlan deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        List<Node> nodes = new ArrayList<>();
        for (JsonNode node : elements(root, "nodes")) {
            nodes.add(mapper.treeToValue(node, Node.class));
        }
        List<NodeInstance> nodeInstances = new ArrayList<>();
        for (JsonNode instance : elements(root, "node_instances")) {
            nodeInstances.add(mapper.treeToValue(instance, NodeInstance.class));
        }

        return DeploymentPlan.builder()
                .nodes(nodes)
                .nodeInstances(nodeInstances)
                .workflows(readWorkflows(mapper, root.get("workflows")))
                .outputs(readValue(mapper, root, "outputs", OBJECT_MAP, Map.of()))
                .build();
    }

    private Map<String, WorkflowDefinition> readWorkflows(ObjectMapper mapper, JsonNode workflows)
            throws IOException {
        Map<String, WorkflowDefinition> result = new LinkedHashMap<>();
        if (workflows == null || workflows.isNull()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = workflows.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String name = entry.getKey();
            JsonNode workflow = entry.getValue();
            result.put(
                    name,
                    new WorkflowDefinition(
                            name,
                            readOperation(mapper, workflow, name),
                            readParameters(mapper, workflow.get("parameters"))));
        }
        return result;
    }

    private Map<String, ParameterDefinition> readParameters(ObjectMapper mapper, JsonNode parameters)
            throws IOException {
        Map<String, ParameterDefinition> result = new LinkedHashMap<>();
        if (parameters == null || parameters.isNull()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = parameters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode parameter = entry.getValue();
            boolean hasDefault = parameter.has("default");
            Object defaultValue =
                    hasDefault ? mapper.treeToValue(parameter.get("default"), Object.class) : null;
            result.put(
                    entry.getKey(),
                    new ParameterDefinition(
                            hasDefault, defaultValue, textOrNull(parameter, "description")));
        }
        return result;
    }
}
