package io.plinth.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.exception.NotFoundException;
import io.plinth.core.exception.ParameterValidationException;
import io.plinth.core.exception.WorkflowExecutionException;
import io.plinth.core.execution.DefaultOperationRegistry;
import io.plinth.core.execution.ExecutionContext;
import io.plinth.core.execution.OperationHandler;
import io.plinth.core.execution.RetryPolicy;
import io.plinth.core.output.DefaultFunctionParser;
import io.plinth.core.plan.NodeInstance;
import io.plinth.core.storage.InMemoryInstanceStoreProvider;
import io.plinth.core.storage.spi.InstanceStoreProvider;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlinthEnvironmentTest {

    @TempDir Path resourcesRoot;

    @Mock private OperationHandler workflowHandler;

    private PlinthEnvironment environment;

    @BeforeEach
    void setUp() {
        environment =
                PlinthFactory.createEnvironment(
                        TestPlans.twoTier(), resourcesRoot, TestPlans.registry(workflowHandler));
    }

    @Nested
    class ConstructionTest {

        @Test
        void shouldFailBeforeCreatingStoreWhenMappingIsUnresolvable() {
            // Given
            DefaultOperationRegistry registry = new DefaultOperationRegistry();
            registry.register(TestPlans.CREATE, (ctx, params) -> {});
            InstanceStoreProvider provider = mock(InstanceStoreProvider.class);

            // When / Then
            assertThatThrownBy(
                            () ->
                                    new PlinthEnvironment(
                                            new PlinthConfig(),
                                            TestPlans.twoTier(),
                                            resourcesRoot,
                                            registry,
                                            provider,
                                            new DefaultFunctionParser()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("mapping error")
                    .hasMessageContaining("node=web_server");
            verifyNoInteractions(provider);
        }

        @Test
        void shouldExposeNameAndStore() {
            assertThat(environment.getName()).isEqualTo("local");
            assertThat(environment.getStorage().getName()).isEqualTo("local");
            assertThat(environment.getStorage().getNodeInstances()).hasSize(3);
        }

        @Test
        void shouldNotResolveWorkflowsAtConstruction() {
            // Given
            DefaultOperationRegistry registry = TestPlans.registry(workflowHandler);
            DefaultOperationRegistry withoutWorkflows = new DefaultOperationRegistry();
            for (String path :
                    List.of(
                            TestPlans.CREATE,
                            TestPlans.CONFIGURE,
                            TestPlans.CONNECT,
                            TestPlans.ACCEPT)) {
                withoutWorkflows.register(path, registry.find(path).orElseThrow());
            }

            // When
            PlinthEnvironment lazy =
                    PlinthFactory.createEnvironment(
                            TestPlans.twoTier(), resourcesRoot, withoutWorkflows);

            // Then
            assertThatThrownBy(() -> lazy.execute("install"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("No module named workflows")
                    .hasMessageContaining("type=workflow");
        }
    }

    @Nested
    class ExecuteTest {

        @Test
        void shouldInvokeWorkflowWithContext() throws Exception {
            // Given
            ArgumentCaptor<ExecutionContext> context = ArgumentCaptor.forClass(ExecutionContext.class);

            // When
            environment.execute("install");

            // Then
            verify(workflowHandler).invoke(context.capture(), eq(Map.of()));
            ExecutionContext captured = context.getValue();
            assertThat(captured.local()).isTrue();
            assertThat(captured.deploymentId()).isEqualTo("local");
            assertThat(captured.blueprintId()).isEqualTo("local");
            assertThat(captured.workflowId()).isEqualTo("install");
            assertThat(captured.executionId()).isNotBlank();
            assertThat(captured.storage()).isSameAs(environment.getStorage());
            assertThat(captured.retryPolicy()).isEqualTo(RetryPolicy.DEFAULT);
            assertThat(captured.taskThreadPoolSize()).isEqualTo(1);
        }

        @Test
        void shouldUseFreshExecutionIdPerRun() throws Exception {
            // Given
            ArgumentCaptor<ExecutionContext> context = ArgumentCaptor.forClass(ExecutionContext.class);

            // When
            environment.execute("install");
            environment.execute("install");

            // Then
            verify(workflowHandler, times(2)).invoke(context.capture(), anyMap());
            List<ExecutionContext> contexts = context.getAllValues();
            assertThat(contexts.get(0).executionId()).isNotEqualTo(contexts.get(1).executionId());
        }

        @Test
        void shouldPassExplicitRetryPolicyAndPoolSize() throws Exception {
            // Given
            ArgumentCaptor<ExecutionContext> context = ArgumentCaptor.forClass(ExecutionContext.class);
            RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(2));

            // When
            environment.execute("scale", Map.of(), false, policy, 4);

            // Then
            verify(workflowHandler).invoke(context.capture(), eq(Map.of("delta", 1)));
            assertThat(context.getValue().retryPolicy()).isEqualTo(policy);
            assertThat(context.getValue().taskThreadPoolSize()).isEqualTo(4);
        }

        @Test
        void shouldRejectMissingMandatoryParameterBeforeInvoking() throws Exception {
            assertThatThrownBy(() -> environment.execute("deploy", Map.of()))
                    .isInstanceOf(ParameterValidationException.class)
                    .hasMessageContaining("x")
                    .satisfies(
                            e ->
                                    assertThat(((ParameterValidationException) e).getParameterNames())
                                            .containsExactly("x"));
            verify(workflowHandler, never()).invoke(any(), anyMap());
        }

        @Test
        void shouldRejectUndeclaredParameters() throws Exception {
            assertThatThrownBy(() -> environment.execute("deploy", Map.of("x", 1, "y", 2)))
                    .isInstanceOf(ParameterValidationException.class)
                    .hasMessageContaining("y");
            verify(workflowHandler, never()).invoke(any(), anyMap());
        }

        @Test
        void shouldPassUndeclaredParametersWhenAllowed() throws Exception {
            // When
            environment.execute("deploy", Map.of("x", 1, "y", 2), true);

            // Then
            verify(workflowHandler).invoke(any(ExecutionContext.class), eq(Map.of("x", 1, "y", 2)));
        }

        @Test
        void shouldListWorkflowsForUnknownName() {
            assertThatThrownBy(() -> environment.execute("uninstall"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessage(
                            "'uninstall' workflow does not exist. existing workflows are:"
                                    + " [install, deploy, scale]");
        }

        @Test
        void shouldWrapCheckedFailure() throws Exception {
            // Given
            IOException failure = new IOException("disk full");
            doThrow(failure).when(workflowHandler).invoke(any(), anyMap());

            // When / Then
            assertThatThrownBy(() -> environment.execute("install"))
                    .isInstanceOf(WorkflowExecutionException.class)
                    .hasCause(failure)
                    .satisfies(
                            e ->
                                    assertThat(((WorkflowExecutionException) e).getWorkflowId())
                                            .isEqualTo("install"));
        }

        @Test
        void shouldPropagateUncheckedFailure() throws Exception {
            // Given
            IllegalStateException failure = new IllegalStateException("boom");
            doThrow(failure).when(workflowHandler).invoke(any(), anyMap());

            // When / Then
            assertThatThrownBy(() -> environment.execute("install")).isSameAs(failure);
        }

        @Test
        void shouldRestoreInterruptFlag() throws Exception {
            // Given
            doThrow(new InterruptedException()).when(workflowHandler).invoke(any(), anyMap());

            // When
            try {
                assertThatThrownBy(() -> environment.execute("install"))
                        .isInstanceOf(WorkflowExecutionException.class)
                        .hasCauseInstanceOf(InterruptedException.class);

                // Then
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    class OutputsTest {

        @Test
        void shouldResolveAttributesFromLiveState() throws Exception {
            // Given
            environment.getStorage().updateNodeInstance("web_server_1", 0, Map.of("ip", "10.0.0.1"), null);

            // When
            Map<String, Object> outputs = environment.outputs();

            // Then
            assertThat(outputs).containsEntry("owner", "ops-team");
            assertThat(outputs.get("endpoints"))
                    .asInstanceOf(MAP)
                    .containsEntry("description", "web server addresses")
                    .containsEntry("value", Arrays.asList("10.0.0.1", null));
        }

        @Test
        void shouldReflectWorkflowWrites() throws Exception {
            // Given
            OperationHandler configure =
                    (ctx, params) -> {
                        for (NodeInstance instance : ctx.storage().getNodeInstances()) {
                            if (instance.getNodeId().equals("web_server")) {
                                ctx.storage()
                                        .updateNodeInstance(
                                                instance.getId(),
                                                instance.getVersion(),
                                                Map.of("ip", "ip-of-" + instance.getId()),
                                                "started");
                            }
                        }
                    };
            PlinthEnvironment configured =
                    PlinthFactory.createEnvironment(
                            TestPlans.twoTier(), resourcesRoot, TestPlans.registry(configure));

            // When
            configured.execute("install");

            // Then
            assertThat(configured.outputs().get("endpoints"))
                    .asInstanceOf(MAP)
                    .containsEntry("value", List.of("ip-of-web_server_1", "ip-of-web_server_2"));
            assertThat(configured.getStorage().getNodeInstance("web_server_2").getState())
                    .isEqualTo("started");
        }
    }

    @Test
    void shouldUseBuiltInMemoryBackendByDefault() {
        assertThat(new PlinthConfig().getStorageType()).isEqualTo(InMemoryInstanceStoreProvider.NAME);
    }
}
