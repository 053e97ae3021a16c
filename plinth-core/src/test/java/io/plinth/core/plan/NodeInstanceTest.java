package io.plinth.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NodeInstanceTest {

    @Test
    void shouldDefaultToUninitializedStateAtVersionZero() {
        // When
        NodeInstance instance = NodeInstance.builder().id("vm_1").nodeId("vm").build();

        // Then
        assertThat(instance.getState()).isEqualTo(NodeInstance.INITIAL_STATE);
        assertThat(instance.getVersion()).isZero();
        assertThat(instance.getRuntimeProperties()).isEmpty();
        assertThat(instance.getRelationships()).isEmpty();
    }

    @Test
    void shouldRequireIdAndNodeId() {
        assertThatThrownBy(() -> NodeInstance.builder().nodeId("vm").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Node instance ID");
        assertThatThrownBy(() -> NodeInstance.builder().id("vm_1").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Node ID");
    }

    @Test
    void shouldCopyIndependently() {
        // Given
        Map<String, Object> nested = new HashMap<>();
        nested.put("ips", new ArrayList<>(List.of("10.0.0.1")));
        NodeInstance original =
                NodeInstance.builder()
                        .id("vm_1")
                        .nodeId("vm")
                        .runtimeProperties(Map.of("network", nested))
                        .version(3)
                        .build();

        // When
        NodeInstance copy = original.copy();
        Map<?, ?> copiedNetwork = (Map<?, ?>) copy.getRuntimeProperties().get("network");
        ((List<?>) copiedNetwork.get("ips")).clear();
        copy.setState("started");

        // Then
        assertThat(copy).isNotEqualTo(original);
        assertThat(original.getState()).isEqualTo(NodeInstance.INITIAL_STATE);
        assertThat(original.getRuntimeProperties().get("network"))
                .asInstanceOf(MAP)
                .extractingByKey("ips")
                .asInstanceOf(LIST)
                .containsExactly("10.0.0.1");
    }

    @Test
    void shouldBeEqualToItsCopy() {
        // Given
        NodeInstance original =
                NodeInstance.builder()
                        .id("vm_1")
                        .nodeId("vm")
                        .state("started")
                        .runtimeProperties(Map.of("ip", "10.0.0.1"))
                        .relationships(
                                List.of(new RelationshipInstance("contained_in", "host_1", "host")))
                        .build();

        // When / Then
        assertThat(original.copy()).isEqualTo(original).hasSameHashCodeAs(original);
    }

    @Test
    void shouldClearRuntimePropertiesWhenSetToNull() {
        // Given
        NodeInstance instance =
                NodeInstance.builder()
                        .id("vm_1")
                        .nodeId("vm")
                        .runtimeProperties(Map.of("ip", "10.0.0.1"))
                        .build();

        // When
        instance.setRuntimeProperties(null);

        // Then
        assertThat(instance.getRuntimeProperties()).isEmpty();
    }

    @Test
    void shouldKeepRuntimePropertiesInJsonForm() {
        // Given
        NodeInstance instance = NodeInstance.builder().id("vm_1").nodeId("vm").build();

        // When
        instance.setRuntimeProperties(
                Map.of("port", 8080L, "ratio", 0.5f, "ips", new String[] {"10.0.0.1"}));

        // Then
        assertThat(instance.getRuntimeProperties())
                .isEqualTo(Map.of("port", 8080, "ratio", 0.5d, "ips", List.of("10.0.0.1")));
    }
}
