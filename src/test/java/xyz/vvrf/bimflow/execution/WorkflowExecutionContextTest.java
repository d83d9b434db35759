package xyz.vvrf.bimflow.execution;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.builder.WorkflowGraphBuilder;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.ProgressSink;
import xyz.vvrf.bimflow.core.WorkflowGraph;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowExecutionContextTest {

    private final WorkflowGraph graph = new WorkflowGraphBuilder("ctx")
            .addNode("A", "k")
            .addNode("B", "k")
            .addEdge("A", "B")
            .build();

    private WorkflowExecutionContext newContext() {
        return new WorkflowExecutionContext(graph, Collections.emptyMap(), ProgressSink.NOOP);
    }

    @Test
    void shouldGenerateRunIdAndStartAllNodesPending() {
        WorkflowExecutionContext context = newContext();

        assertThat(context.getRunId()).startsWith("flow-run-");
        assertThat(context.getNodeState("A")).isEqualTo(NodeState.PENDING);
        assertThat(context.getNodeState("B")).isEqualTo(NodeState.PENDING);
        assertThat(context.getCancellationToken().isCancellationRequested()).isFalse();
    }

    @Test
    void shouldCreateNodeMonoOnlyOnce() {
        WorkflowExecutionContext context = newContext();
        AtomicInteger created = new AtomicInteger();

        Mono<NodeResult> first = context.getOrCreateNodeMono("A", () -> {
            created.incrementAndGet();
            return Mono.just(NodeResult.of(1));
        });
        Mono<NodeResult> second = context.getOrCreateNodeMono("A", () -> {
            created.incrementAndGet();
            return Mono.just(NodeResult.of(2));
        });

        assertThat(second).isSameAs(first);
        assertThat(created).hasValue(1);
    }

    @Test
    void shouldKeepFirstRecordedResult() {
        WorkflowExecutionContext context = newContext();

        assertThat(context.recordCompletedResult("A", NodeResult.of("first"))).isTrue();
        assertThat(context.recordCompletedResult("A", NodeResult.of("second"))).isFalse();

        assertThat(context.getCompletedResult("A")).contains(NodeResult.of("first"));
        assertThat(context.getNodeState("A")).isEqualTo(NodeState.CACHED);
        assertThat(context.getCompletedNodeCount()).isEqualTo(1);
    }

    @Test
    void shouldReturnResultsInExecutionOrder() {
        WorkflowExecutionContext context = newContext();
        context.setExecutionOrder(Arrays.asList("A", "B"));
        context.recordCompletedResult("B", NodeResult.of("b"));
        context.recordCompletedResult("A", NodeResult.of("a"));

        assertThat(context.getResultsInOrder().keySet()).containsExactly("A", "B");
    }

    @Test
    void shouldExposeCancellationThroughToken() {
        WorkflowExecutionContext context = newContext();

        assertThat(context.requestCancellation()).isTrue();
        assertThat(context.requestCancellation()).isFalse();
        assertThat(context.getCancellationToken().isCancellationRequested()).isTrue();
    }

    @Test
    void shouldDropResultsOnDiscard() {
        WorkflowExecutionContext context = newContext();
        context.setExecutionOrder(Arrays.asList("A", "B"));
        context.recordCompletedResult("A", NodeResult.of("a"));

        context.discard();

        assertThat(context.getResultsInOrder()).isEmpty();
    }
}
