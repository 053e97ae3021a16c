package io.plinth.core.execution;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.plinth.core.TestPlans;
import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.plan.DeploymentPlan;
import io.plinth.core.plan.Node;
import io.plinth.core.plan.OperationDescriptor;
import io.plinth.core.plan.Relationship;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MappingValidatorTest {

    private final DefaultOperationRegistry registry = TestPlans.registry((ctx, params) -> {});

    @Test
    void shouldAcceptFullyResolvablePlan() {
        assertThatCode(() -> new MappingValidator(registry).validate(TestPlans.twoTier()))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldNameNodeAndKindForMissingModule() {
        // Given
        DeploymentPlan plan =
                planWith(
                        Node.builder()
                                .id("vm")
                                .operation("create", OperationDescriptor.of("missing.module.create"))
                                .build());

        // When / Then
        assertThatThrownBy(() -> new MappingValidator(registry).validate(plan))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage(
                        "mapping error: No module named missing.module [node=vm, type=operations]")
                .hasCauseInstanceOf(OperationNotFoundException.class);
    }

    @Test
    void shouldNameMissingAttribute() {
        // Given
        DeploymentPlan plan =
                planWith(
                        Node.builder()
                                .id("vm")
                                .operation("delete", OperationDescriptor.of("plugins.web.delete"))
                                .build());

        // When / Then
        assertThatThrownBy(() -> new MappingValidator(registry).validate(plan))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("plugins.web has no attribute 'delete'")
                .hasMessageContaining("[node=vm, type=operations]");
    }

    @Test
    void shouldValidateSourceOperations() {
        // Given
        DeploymentPlan plan =
                planWith(
                        Node.builder()
                                .id("vm")
                                .relationships(
                                        List.of(
                                                relationship(
                                                        Map.of(
                                                                "preconfigure",
                                                                OperationDescriptor.of("nope.connect")),
                                                        Map.of())))
                                .build());

        // When / Then
        assertThatThrownBy(() -> new MappingValidator(registry).validate(plan))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("type=source_operations");
    }

    @Test
    void shouldValidateTargetOperations() {
        // Given
        DeploymentPlan plan =
                planWith(
                        Node.builder()
                                .id("vm")
                                .relationships(
                                        List.of(
                                                relationship(
                                                        Map.of(),
                                                        Map.of(
                                                                "establish",
                                                                OperationDescriptor.of(
                                                                        "plugins.relationships.nope")))))
                                .build());

        // When / Then
        assertThatThrownBy(() -> new MappingValidator(registry).validate(plan))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("[node=vm, type=target_operations]");
    }

    private static Relationship relationship(
            Map<String, OperationDescriptor> sourceOperations,
            Map<String, OperationDescriptor> targetOperations) {
        return Relationship.builder()
                .type("plinth.relationships.connected_to")
                .targetId("vm")
                .sourceOperations(sourceOperations)
                .targetOperations(targetOperations)
                .build();
    }

    private static DeploymentPlan planWith(Node node) {
        return DeploymentPlan.builder().nodes(List.of(node)).build();
    }
}
