package io.plinth.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.storage.InMemoryInstanceStore;
import io.plinth.core.storage.InstanceStore;
import io.plinth.core.storage.spi.InstanceStoreProvider;
import io.plinth.core.storage.spi.StoreContext;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class PlinthFactoryTest {

    @TempDir Path resourcesRoot;

    @Test
    void shouldCreateMemoryBackedEnvironmentByDefault() {
        // When
        PlinthEnvironment environment =
                PlinthFactory.createEnvironment(
                        TestPlans.twoTier(), resourcesRoot, TestPlans.registry((ctx, params) -> {}));

        // Then
        assertThat(environment.getStorage()).isInstanceOf(InMemoryInstanceStore.class);
    }

    @Test
    void shouldRejectUnknownStorageType() {
        assertThatThrownBy(
                        () ->
                                PlinthFactory.builder()
                                        .config(PlinthConfig.builder().storageType("redis").build())
                                        .plan(TestPlans.twoTier())
                                        .resourcesRoot(resourcesRoot)
                                        .operationResolver(TestPlans.registry((ctx, params) -> {}))
                                        .discoverStoreProviders(false)
                                        .build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown storage backend 'redis'");
    }

    @Test
    void shouldHandContextToSelectedProvider() {
        // Given
        InstanceStore store = mock(InstanceStore.class);
        InstanceStoreProvider provider = mock(InstanceStoreProvider.class);
        when(provider.getName()).thenReturn("custom");
        when(provider.create(any())).thenReturn(store);
        PlinthConfig config =
                PlinthConfig.builder().deploymentName("shop").storageType("custom").build();

        // When
        PlinthEnvironment environment =
                PlinthFactory.builder()
                        .config(config)
                        .plan(TestPlans.twoTier())
                        .resourcesRoot(resourcesRoot)
                        .operationResolver(TestPlans.registry((ctx, params) -> {}))
                        .storeProviders(List.of(provider))
                        .discoverStoreProviders(false)
                        .build();

        // Then
        ArgumentCaptor<StoreContext> context = ArgumentCaptor.forClass(StoreContext.class);
        verify(provider).create(context.capture());
        assertThat(environment.getStorage()).isSameAs(store);
        assertThat(context.getValue().name()).isEqualTo("shop");
        assertThat(context.getValue().resourcesRoot()).isEqualTo(resourcesRoot);
        assertThat(context.getValue().nodeInstances()).hasSize(3);
        assertThat(context.getValue().config()).isSameAs(config);
    }

    @Test
    void shouldRequirePlanAndResolver() {
        assertThatThrownBy(() -> PlinthFactory.builder().resourcesRoot(resourcesRoot).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("plan");
    }
}
