package io.plinth.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.plinth.core.exception.ConfigurationException;
import io.plinth.core.storage.spi.InstanceStoreProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class InstanceStoreProvidersTest {

    @Test
    void shouldAlwaysOfferMemoryBackend() {
        // When
        InstanceStoreProviders providers = new InstanceStoreProviders(List.of(), false);

        // Then
        assertThat(providers.names()).containsExactly(InMemoryInstanceStoreProvider.NAME);
        assertThat(providers.get("memory")).isInstanceOf(InMemoryInstanceStoreProvider.class);
    }

    @Test
    void shouldRegisterExplicitProviders() {
        // Given
        InstanceStoreProvider custom = mock(InstanceStoreProvider.class);
        when(custom.getName()).thenReturn("custom");

        // When
        InstanceStoreProviders providers = new InstanceStoreProviders(List.of(custom), false);

        // Then
        assertThat(providers.get("custom")).isSameAs(custom);
        assertThat(providers.names()).containsExactly("memory", "custom");
    }

    @Test
    void shouldLetExplicitProviderReplaceBuiltIn() {
        // Given
        InstanceStoreProvider replacement = mock(InstanceStoreProvider.class);
        when(replacement.getName()).thenReturn("memory");

        // When
        InstanceStoreProviders providers = new InstanceStoreProviders(List.of(replacement), true);

        // Then
        assertThat(providers.get("memory")).isSameAs(replacement);
    }

    @Test
    void shouldListAvailableBackendsForUnknownName() {
        // Given
        InstanceStoreProviders providers = new InstanceStoreProviders(List.of(), false);

        // When / Then
        assertThatThrownBy(() -> providers.get("redis"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'redis'")
                .hasMessageContaining("[memory]");
    }
}
