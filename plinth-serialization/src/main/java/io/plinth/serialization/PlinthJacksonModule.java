package io.plinth.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.plinth.core.plan.DeploymentPlan;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.NodeInstance;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Plinth serialization configuration in one place.
///
/// Every plan type is immutable or builder-constructed, so each gets an explicit tree-based
/// serializer/deserializer pair instead of reflective bean binding:
/// - `DeploymentPlan`: `DeploymentPlanSerializer` / `DeploymentPlanDeserializer`
/// - `Node`: `NodeSerializer` / `NodeDeserializer`
/// - `NodeInstance`: `NodeInstanceSerializer` / `NodeInstanceDeserializer`
///
/// Field names are snake_case, matching the compiled plan format (`node_id`,
/// `runtime_properties`, `source_operations`, ...).
///
/// @see PlanSerializer for the convenience factory API
public class PlinthJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3170962184402781456L;

    public PlinthJacksonModule() {
        super("PlinthJacksonModule");

        addSerializer(DeploymentPlan.class, new DeploymentPlanSerializer());
        addDeserializer(DeploymentPlan.class, new DeploymentPlanDeserializer());

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(NodeInstance.class, new NodeInstanceSerializer());
        addDeserializer(NodeInstance.class, new NodeInstanceDeserializer());
    }
}
