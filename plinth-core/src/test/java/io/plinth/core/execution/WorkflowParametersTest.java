package io.plinth.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.plinth.core.exception.ParameterValidationException;
import io.plinth.core.plan.OperationDescriptor;
import io.plinth.core.plan.ParameterDefinition;
import io.plinth.core.plan.WorkflowDefinition;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowParametersTest {

    private static WorkflowDefinition workflow() {
        Map<String, ParameterDefinition> parameters = new LinkedHashMap<>();
        parameters.put("node_id", ParameterDefinition.mandatory());
        parameters.put("operation", ParameterDefinition.mandatory());
        parameters.put("delta", ParameterDefinition.withDefault(1));
        parameters.put("label", ParameterDefinition.withDefault(null));
        return new WorkflowDefinition(
                "execute_operation", OperationDescriptor.of("workflows.execute"), parameters);
    }

    @Nested
    class MandatoryTest {

        @Test
        void shouldNameEveryMissingMandatoryParameter() {
            assertThatThrownBy(() -> WorkflowParameters.merge(workflow(), Map.of(), false))
                    .isInstanceOf(ParameterValidationException.class)
                    .hasMessage(
                            "Workflow \"execute_operation\" must be provided with the following"
                                    + " parameters to execute: node_id,operation")
                    .satisfies(
                            e ->
                                    assertThat(((ParameterValidationException) e).getParameterNames())
                                            .containsExactly("node_id", "operation"));
        }

        @Test
        void shouldTreatNullParametersAsEmpty() {
            assertThatThrownBy(() -> WorkflowParameters.merge(workflow(), null, false))
                    .isInstanceOf(ParameterValidationException.class);
        }

        @Test
        void shouldAcceptExplicitNullForMandatoryParameter() {
            // Given
            Map<String, Object> supplied = new HashMap<>();
            supplied.put("node_id", null);
            supplied.put("operation", "start");

            // When
            Map<String, Object> merged = WorkflowParameters.merge(workflow(), supplied, false);

            // Then
            assertThat(merged).containsEntry("node_id", null);
        }
    }

    @Nested
    class DefaultsTest {

        @Test
        void shouldFillInDefaults() {
            // When
            Map<String, Object> merged =
                    WorkflowParameters.merge(
                            workflow(), Map.of("node_id", "vm", "operation", "start"), false);

            // Then
            assertThat(merged)
                    .containsEntry("node_id", "vm")
                    .containsEntry("operation", "start")
                    .containsEntry("delta", 1)
                    .containsEntry("label", null);
        }

        @Test
        void shouldPreferSuppliedValueOverDefault() {
            // When
            Map<String, Object> merged =
                    WorkflowParameters.merge(
                            workflow(),
                            Map.of("node_id", "vm", "operation", "start", "delta", 5),
                            false);

            // Then
            assertThat(merged).containsEntry("delta", 5);
        }

        @Test
        void shouldHandOutIndependentCopiesOfContainerDefaults() {
            // Given
            ParameterDefinition hosts = ParameterDefinition.withDefault(List.of("a", "b"));
            WorkflowDefinition workflow =
                    new WorkflowDefinition(
                            "scale",
                            OperationDescriptor.of("workflows.scale"),
                            Map.of("hosts", hosts));
            Map<String, Object> first = WorkflowParameters.merge(workflow, Map.of(), false);

            // When
            ((List<?>) first.get("hosts")).clear();
            Map<String, Object> second = WorkflowParameters.merge(workflow, Map.of(), false);

            // Then
            assertThat(second).containsEntry("hosts", List.of("a", "b"));
            assertThat(hosts.defaultValue()).isEqualTo(List.of("a", "b"));
        }

        @Test
        void shouldFreezeContainerDefaults() {
            // Given
            List<Object> hosts = new ArrayList<>(List.of("a"));
            ParameterDefinition parameter = ParameterDefinition.withDefault(hosts);

            // When
            hosts.add("b");

            // Then
            assertThat(parameter.defaultValue()).isEqualTo(List.of("a"));
            assertThatThrownBy(() -> ((List<?>) parameter.defaultValue()).clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class CustomParametersTest {

        @Test
        void shouldRejectUndeclaredParametersTogether() {
            // Given
            Map<String, Object> supplied = new LinkedHashMap<>();
            supplied.put("node_id", "vm");
            supplied.put("operation", "start");
            supplied.put("force", true);
            supplied.put("dry_run", false);

            // When / Then
            assertThatThrownBy(() -> WorkflowParameters.merge(workflow(), supplied, false))
                    .isInstanceOf(ParameterValidationException.class)
                    .hasMessageContaining("does not have the following parameters declared: force,dry_run")
                    .satisfies(
                            e ->
                                    assertThat(((ParameterValidationException) e).getParameterNames())
                                            .containsExactly("force", "dry_run"));
        }

        @Test
        void shouldPassUndeclaredParametersThroughWhenAllowed() {
            // When
            Map<String, Object> merged =
                    WorkflowParameters.merge(
                            workflow(),
                            Map.of("node_id", "vm", "operation", "start", "force", true),
                            true);

            // Then
            assertThat(merged).containsEntry("force", true).hasSize(5);
        }

        @Test
        void shouldReportMissingBeforeCustom() {
            assertThatThrownBy(
                            () -> WorkflowParameters.merge(workflow(), Map.of("force", true), false))
                    .isInstanceOf(ParameterValidationException.class)
                    .hasMessageContaining("must be provided");
        }
    }
}
