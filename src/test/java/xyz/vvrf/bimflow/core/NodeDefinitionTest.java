package xyz.vvrf.bimflow.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeDefinitionTest {

    @Test
    void shouldParseStringEncodedNumbersAndBooleans() {
        Map<String, Object> props = new HashMap<>();
        props.put("distance", "2.5");
        props.put("tolerance", 10);
        props.put("useValueInput", "TRUE");
        props.put("broken", "abc");
        NodeDefinition node = NodeDefinition.of("n", "k", props);

        assertThat(node.getDouble("distance", 1.0)).isEqualTo(2.5);
        assertThat(node.getDouble("tolerance", 0)).isEqualTo(10.0);
        assertThat(node.getDouble("broken", 1.0)).isEqualTo(1.0);
        assertThat(node.getDouble("missing", 3.0)).isEqualTo(3.0);
        assertThat(node.getBoolean("useValueInput", false)).isTrue();
        assertThat(node.getBoolean("broken", false)).isFalse();
    }

    @Test
    void shouldTreatEmptyStringAsMissing() {
        NodeDefinition node = NodeDefinition.of("n", "k", java.util.Collections.singletonMap("format", ""));
        assertThat(node.getString("format", "csv")).isEqualTo("csv");
    }

    @Test
    void shouldCopyPropertiesDefensively() {
        Map<String, Object> props = new HashMap<>();
        props.put("a", 1);
        NodeDefinition node = NodeDefinition.of("n", "k", props);
        props.put("b", 2);

        assertThat(node.getProperties()).containsOnlyKeys("a");
        assertThatThrownBy(() -> node.getProperties().put("c", 3))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldReadTypedPropertyOnlyWhenTypeMatches() {
        NodeDefinition node = NodeDefinition.of("n", "k", java.util.Collections.singletonMap("value", 42));
        assertThat(node.getProperty("value", Integer.class)).contains(42);
        assertThat(node.getProperty("value", String.class)).isEmpty();
    }
}
