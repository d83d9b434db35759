package xyz.vvrf.bimflow.registry;

import org.junit.jupiter.api.Test;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.handler.BuiltinNodeHandlers;
import xyz.vvrf.bimflow.handler.NodeKinds;
import xyz.vvrf.bimflow.handler.SpatialNodeHandler;
import xyz.vvrf.bimflow.test.util.TestNodeHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleNodeHandlerRegistryTest {

    private final SimpleNodeHandlerRegistry registry = new SimpleNodeHandlerRegistry();

    @Test
    void shouldRegisterHandlerWithMetadata() {
        registry.register(NodeKinds.SPATIAL, new SpatialNodeHandler());

        assertThat(registry.isRegistered(NodeKinds.SPATIAL)).isTrue();
        assertThat(registry.getMetadata(NodeKinds.SPATIAL)).get().satisfies(meta -> {
            assertThat(meta.getExecutionMode()).isEqualTo(ExecutionMode.SYNC);
            assertThat(meta.getInputPorts()).contains(Ports.INPUT, Ports.REFERENCE);
            assertThat(meta.getImplementationClass()).isEqualTo(SpatialNodeHandler.class);
        });
    }

    @Test
    void shouldRejectDuplicateKind() {
        registry.register("k", TestNodeHandler.builder().build());

        assertThatThrownBy(() -> registry.register("k", TestNodeHandler.builder().build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("k");
    }

    @Test
    void shouldRejectBlankKind() {
        assertThatThrownBy(() -> registry.register("  ", TestNodeHandler.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReturnEmptyForUnknownKind() {
        assertThat(registry.getHandler("nope")).isEmpty();
        assertThat(registry.getMetadata("nope")).isEmpty();
    }

    @Test
    void shouldRegisterAllBuiltinsExceptAlreadyRegisteredKinds() {
        TestNodeHandler custom = TestNodeHandler.builder().build();
        registry.register(NodeKinds.FILTER, custom);

        BuiltinNodeHandlers.builder().build().registerAll(registry);

        assertThat(registry.getRegisteredKinds()).hasSize(14).contains(
                NodeKinds.IFC, NodeKinds.GEOMETRY, NodeKinds.FILTER, NodeKinds.TRANSFORM, NodeKinds.QUANTITY,
                NodeKinds.PROPERTY, NodeKinds.CLASSIFICATION, NodeKinds.SPATIAL, NodeKinds.RELATIONSHIP,
                NodeKinds.ANALYSIS, NodeKinds.EXPORT, NodeKinds.PARAMETER, NodeKinds.VIEWER, NodeKinds.WATCH);
        assertThat(registry.getHandler(NodeKinds.FILTER)).containsSame(custom);
    }
}
