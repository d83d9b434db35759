package xyz.vvrf.bimflow.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import xyz.vvrf.bimflow.builder.WorkflowGraphBuilder;
import xyz.vvrf.bimflow.core.EdgeDefinition;
import xyz.vvrf.bimflow.core.WorkflowGraph;
import xyz.vvrf.bimflow.exception.CyclicGraphException;
import xyz.vvrf.bimflow.exception.UnknownNodeReferenceException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GraphUtils 测试")
class GraphUtilsTest {

    private static void assertEdgesRespected(WorkflowGraph graph, List<String> order) {
        for (EdgeDefinition edge : graph.getEdges()) {
            assertThat(order.indexOf(edge.getSourceNodeId()))
                    .as("edge %s", edge)
                    .isLessThan(order.indexOf(edge.getTargetNodeId()));
        }
    }

    @Nested
    @DisplayName("topologicalSort")
    class TopologicalSortTests {

        @Test
        void shouldOrderLinearChainRegardlessOfInsertionOrder() {
            WorkflowGraph graph = new WorkflowGraphBuilder("chain")
                    .addNode("C", "k")
                    .addNode("B", "k")
                    .addNode("A", "k")
                    .addEdge("A", "B")
                    .addEdge("B", "C")
                    .build();

            assertThat(GraphUtils.topologicalSort(graph)).containsExactly("A", "B", "C");
        }

        @Test
        void shouldProduceDeterministicDiamondOrder() {
            WorkflowGraph graph = new WorkflowGraphBuilder("diamond")
                    .addNode("A", "k")
                    .addNode("B", "k")
                    .addNode("C", "k")
                    .addNode("D", "k")
                    .addEdge("A", "B")
                    .addEdge("A", "C")
                    .addEdge("B", "D", "input")
                    .addEdge("C", "D", "reference")
                    .build();

            List<String> order = GraphUtils.topologicalSort(graph);

            // 后完成的节点插入到头部
            assertThat(order).containsExactly("A", "C", "B", "D");
            assertEdgesRespected(graph, order);
            assertThat(GraphUtils.topologicalSort(graph)).isEqualTo(order);
        }

        @Test
        void shouldPlaceLaterIndependentNodesFirst() {
            WorkflowGraph graph = new WorkflowGraphBuilder("independent")
                    .addNode("X", "k")
                    .addNode("Y", "k")
                    .build();

            assertThat(GraphUtils.topologicalSort(graph)).containsExactly("Y", "X");
        }

        @Test
        void shouldReturnEmptyOrderForEmptyGraph() {
            WorkflowGraph graph = new WorkflowGraph("empty", Collections.emptyList(), null);
            assertThat(GraphUtils.topologicalSort(graph)).isEmpty();
        }

        @Test
        void shouldRespectEveryEdgeInWiderGraph() {
            WorkflowGraph graph = new WorkflowGraphBuilder("wide")
                    .addNode("export", "k")
                    .addNode("filter", "k")
                    .addNode("ifc", "k")
                    .addNode("quantity", "k")
                    .addNode("param", "k")
                    .addNode("watch", "k")
                    .addEdge("ifc", "filter")
                    .addEdge("param", "filter", "valueInput")
                    .addEdge("filter", "quantity")
                    .addEdge("filter", "export")
                    .addEdge("quantity", "watch")
                    .build();

            List<String> order = GraphUtils.topologicalSort(graph);

            assertThat(order).containsExactlyInAnyOrderElementsOf(graph.getNodeIds());
            assertEdgesRespected(graph, order);
        }
    }

    @Nested
    @DisplayName("环检测")
    class CycleTests {

        @Test
        void shouldRejectTwoNodeCycle() {
            WorkflowGraph graph = new WorkflowGraphBuilder("cycle")
                    .addNode("A", "k")
                    .addNode("B", "k")
                    .addEdge("A", "B")
                    .addEdge("B", "A")
                    .build();

            assertThatThrownBy(() -> GraphUtils.topologicalSort(graph))
                    .isInstanceOf(CyclicGraphException.class)
                    .hasMessageContaining("cycle");
        }

        @Test
        void shouldRejectSelfLoop() {
            WorkflowGraph graph = new WorkflowGraphBuilder("self")
                    .addNode("A", "k")
                    .addEdge("A", "A")
                    .build();

            assertThatThrownBy(() -> GraphUtils.detectCycles(graph))
                    .isInstanceOf(CyclicGraphException.class)
                    .satisfies(e -> {
                        CyclicGraphException ex = (CyclicGraphException) e;
                        assertThat(ex.getFromNodeId()).isEqualTo("A");
                        assertThat(ex.getToNodeId()).isEqualTo("A");
                    });
        }

        @Test
        void shouldRejectCycleNotReachableFromFirstNode() {
            WorkflowGraph graph = new WorkflowGraphBuilder("tail-cycle")
                    .addNode("root", "k")
                    .addNode("P", "k")
                    .addNode("Q", "k")
                    .addNode("R", "k")
                    .addEdge("P", "Q")
                    .addEdge("Q", "R")
                    .addEdge("R", "P")
                    .build();

            assertThatThrownBy(() -> GraphUtils.topologicalSort(graph))
                    .isInstanceOf(CyclicGraphException.class);
        }
    }

    @Nested
    @DisplayName("validateEdgeReferences")
    class EdgeReferenceTests {

        @Test
        void shouldRejectEdgeToUnknownNode() {
            List<EdgeDefinition> edges = Collections.singletonList(EdgeDefinition.of("A", "missing"));

            assertThatThrownBy(() -> GraphUtils.validateEdgeReferences(Arrays.asList("A", "B"), edges, "wf"))
                    .isInstanceOf(UnknownNodeReferenceException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldAcceptKnownReferences() {
            List<EdgeDefinition> edges = Collections.singletonList(EdgeDefinition.of("A", "B"));
            GraphUtils.validateEdgeReferences(Arrays.asList("A", "B"), edges, "wf");
        }
    }
}
