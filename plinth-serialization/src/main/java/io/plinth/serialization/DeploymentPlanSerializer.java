package io.plinth.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.plinth.core.plan.DeploymentPlan;
import io.plinth.core.plan.ParameterDefinition;
import io.plinth.core.plan.WorkflowDefinition;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `DeploymentPlan` to the compiled plan format read by
/// {@link DeploymentPlanDeserializer}.
///
/// A parameter without default is written without a `"default"` key, which is what marks it
/// mandatory; a null default is written as `"default": null`.
///
/// @implNote Package-private. Registered by {@link PlinthJacksonModule}.
class DeploymentPlanSerializer extends StdSerializer<DeploymentPlan> {

    @Serial private static final long serialVersionUID = 4486317722089631507L;

    DeploymentPlanSerializer() {
        super(DeploymentPlan.class);
    }

    @Override
    public void serialize(DeploymentPlan plan, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        provider.defaultSerializeField("nodes", plan.getNodes(), gen);
        provider.defaultSerializeField("node_instances", plan.getNodeInstances(), gen);
        gen.writeObjectFieldStart("workflows");
        for (WorkflowDefinition workflow : plan.getWorkflows().values()) {
            gen.writeFieldName(workflow.name());
            writeWorkflow(workflow, gen, provider);
        }
        gen.writeEndObject();
        provider.defaultSerializeField("outputs", plan.getOutputs(), gen);
        gen.writeEndObject();
    }

    private void writeWorkflow(
            WorkflowDefinition workflow, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("operation", workflow.operation().operation());
        if (workflow.operation().plugin() != null) {
            gen.writeStringField("plugin", workflow.operation().plugin());
        }
        gen.writeObjectFieldStart("parameters");
        for (Map.Entry<String, ParameterDefinition> entry : workflow.parameters().entrySet()) {
            ParameterDefinition parameter = entry.getValue();
            gen.writeObjectFieldStart(entry.getKey());
            if (parameter.hasDefault()) {
                provider.defaultSerializeField("default", parameter.defaultValue(), gen);
            }
            if (parameter.description() != null) {
                gen.writeStringField("description", parameter.description());
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
