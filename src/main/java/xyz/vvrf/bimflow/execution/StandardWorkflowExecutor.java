package xyz.vvrf.bimflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.ProgressSink;
import xyz.vvrf.bimflow.core.WorkflowGraph;
import xyz.vvrf.bimflow.exception.AlreadyRunningException;
import xyz.vvrf.bimflow.exception.UnknownNodeReferenceException;
import xyz.vvrf.bimflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.bimflow.sink.NodeProgressEvent;
import xyz.vvrf.bimflow.sink.RunProgressSink;
import xyz.vvrf.bimflow.util.GraphUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 标准工作流执行器。
 * <p>
 * 先对图做拓扑排序，再按顺序逐个求值节点。每个节点的执行 Mono 通过
 * {@code Mono.defer(...).cache()} 存入运行上下文，因此即便被多个下游拉取，
 * 在一次运行中也最多执行一次。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardWorkflowExecutor implements WorkflowExecutor {

    private final WorkflowGraph graph;
    private final NodeDispatcher nodeDispatcher;
    private final InputResolver inputResolver;
    private final ProgressSink progressSink;
    private final List<WorkflowMonitorListener> monitorListeners;

    private final AtomicReference<WorkflowExecutionContext> activeRun = new AtomicReference<>();
    private final AtomicReference<ExecutorState> state = new AtomicReference<>(ExecutorState.IDLE);
    private final Sinks.Many<NodeProgressEvent> progressEvents = Sinks.many().multicast().directBestEffort();
    private final Object progressEmitLock = new Object();

    /**
     * @param graph            要执行的图快照 (不能为空)
     * @param nodeDispatcher   节点调度器 (不能为空)
     * @param progressSink     外部进度通道，例如 {@link xyz.vvrf.bimflow.sink.NodeStatusStore} (可为 null)
     * @param monitorListeners 监听器列表 (可为 null)
     */
    public StandardWorkflowExecutor(WorkflowGraph graph,
                                    NodeDispatcher nodeDispatcher,
                                    ProgressSink progressSink,
                                    List<WorkflowMonitorListener> monitorListeners) {
        this(graph, nodeDispatcher, new InputResolver(), progressSink, monitorListeners);
    }

    public StandardWorkflowExecutor(WorkflowGraph graph,
                                    NodeDispatcher nodeDispatcher,
                                    InputResolver inputResolver,
                                    ProgressSink progressSink,
                                    List<WorkflowMonitorListener> monitorListeners) {
        this.graph = Objects.requireNonNull(graph, "Workflow graph cannot be null");
        this.nodeDispatcher = Objects.requireNonNull(nodeDispatcher, "Node dispatcher cannot be null");
        this.inputResolver = Objects.requireNonNull(inputResolver, "Input resolver cannot be null");
        this.progressSink = progressSink != null ? progressSink : ProgressSink.NOOP;
        this.monitorListeners = monitorListeners != null
                ? new CopyOnWriteArrayList<>(monitorListeners)
                : Collections.emptyList();
        log.debug("StandardWorkflowExecutor created for workflow '{}' ({} nodes, {} listeners)",
                graph.getName(), graph.size(), this.monitorListeners.size());
    }

    @Override
    public Mono<WorkflowRunResult> execute() {
        return Mono.defer(() -> {
            WorkflowExecutionContext running = activeRun.get();
            if (running != null) {
                return rejectExecute(running);
            }
            String runId = WorkflowExecutionContext.newRunId();
            RunProgressSink runSink = new RunProgressSink(
                    runId, graph.getName(), progressSink, progressEvents, progressEmitLock);
            WorkflowExecutionContext context = new WorkflowExecutionContext(
                    runId, graph, nodeDispatcher.bindHandlers(graph), runSink);

            if (!activeRun.compareAndSet(null, context)) {
                context.discard();
                return rejectExecute(activeRun.get());
            }
            state.set(ExecutorState.RUNNING);

            return runWorkflow(context)
                    .doOnSuccess(result -> finishRun(context,
                            result.getStatus() == RunStatus.CANCELLED ? ExecutorState.CANCELLED : ExecutorState.COMPLETED))
                    .doOnError(e -> finishRun(context, ExecutorState.ABORTED))
                    .doOnCancel(() -> {
                        log.warn("[RunId: {}][Workflow: '{}'] Run subscription cancelled.", runId, graph.getName());
                        context.requestCancellation();
                        finishRun(context, ExecutorState.CANCELLED);
                    })
                    .doFinally(signal -> context.discard());
        });
    }

    private Mono<WorkflowRunResult> rejectExecute(WorkflowExecutionContext current) {
        String activeRunId = current != null ? current.getRunId() : "unknown";
        log.warn("[Workflow: '{}'] Rejecting execute(): run '{}' is still active.", graph.getName(), activeRunId);
        return Mono.error(new AlreadyRunningException(graph.getName(), activeRunId));
    }

    private Mono<WorkflowRunResult> runWorkflow(WorkflowExecutionContext context) {
        final String runId = context.getRunId();
        final String workflowName = context.getWorkflowName();

        return Mono.fromCallable(() -> GraphUtils.topologicalSort(graph))
                .flatMap(order -> {
                    context.setExecutionOrder(order);
                    log.info("[RunId: {}][Workflow: '{}'] Starting run. Execution order: {}", runId, workflowName, order);
                    safeNotifyListeners(l -> l.onRunStart(runId, workflowName, graph));

                    return Flux.fromIterable(order)
                            .concatMap(nodeId -> getNodeMono(nodeId, context).then())
                            .then(Mono.fromCallable(() -> buildRunResult(context)));
                })
                .doOnSuccess(result -> {
                    log.info("[RunId: {}][Workflow: '{}'] Run finished with status {} in {}ms ({} / {} nodes cached).",
                            runId, workflowName, result.getStatus(), result.getDuration().toMillis(),
                            result.getResults().size(), graph.size());
                    safeNotifyListeners(l -> l.onRunComplete(runId, workflowName, result.getDuration(),
                            result.getStatus(), result.getResults(), null));
                })
                .doOnError(e -> {
                    Duration duration = Duration.between(context.getStartTime(), Instant.now());
                    log.error("[RunId: {}][Workflow: '{}'] Run aborted after {}ms: {}",
                            runId, workflowName, duration.toMillis(), e.getMessage(), e);
                    safeNotifyListeners(l -> l.onRunComplete(runId, workflowName, duration,
                            RunStatus.ABORTED, Collections.emptyMap(), e));
                });
    }

    /**
     * 获取或创建节点的缓存执行 Mono。
     */
    private Mono<NodeResult> getNodeMono(String nodeId, WorkflowExecutionContext context) {
        return context.getOrCreateNodeMono(nodeId,
                () -> Mono.defer(() -> evaluateNode(nodeId, context)).cache());
    }

    private Mono<NodeResult> evaluateNode(String nodeId, WorkflowExecutionContext context) {
        NodeDefinition node = graph.getNode(nodeId).orElse(null);
        if (node == null) {
            return Mono.error(new UnknownNodeReferenceException(context.getWorkflowName(), nodeId, "execution order"));
        }
        if (context.isCancellationRequested()) {
            return skipNode(node, context);
        }

        context.markNodeState(nodeId, NodeState.RESOLVING_INPUTS);
        return inputResolver.resolve(nodeId, context, upstreamId -> getNodeMono(upstreamId, context))
                .flatMap(inputs -> {
                    if (context.isCancellationRequested()) {
                        return skipNode(node, context);
                    }
                    context.markNodeState(nodeId, NodeState.DISPATCHING);
                    return nodeDispatcher.dispatch(node, inputs, context)
                            .doOnNext(result -> context.recordCompletedResult(nodeId, result));
                });
    }

    private Mono<NodeResult> skipNode(NodeDefinition node, WorkflowExecutionContext context) {
        context.markNodeState(node.getId(), NodeState.SKIPPED);
        log.debug("[RunId: {}][Workflow: '{}'] Skipping node '{}' because the run was stopped.",
                context.getRunId(), context.getWorkflowName(), node.getId());
        safeNotifyListeners(l -> l.onNodeSkipped(context.getRunId(), context.getWorkflowName(), node.getId(), node.getKind()));
        return Mono.empty();
    }

    private WorkflowRunResult buildRunResult(WorkflowExecutionContext context) {
        RunStatus status = context.isCancellationRequested() ? RunStatus.CANCELLED : RunStatus.COMPLETED;
        Map<String, NodeResult> results = context.getResultsInOrder();
        return new WorkflowRunResult(context.getRunId(), context.getWorkflowName(), status, results,
                Duration.between(context.getStartTime(), Instant.now()));
    }

    /**
     * 仅当给定运行仍是活动运行时才更新执行器状态；被 stop() 提前释放的运行不再改变状态。
     */
    private void finishRun(WorkflowExecutionContext context, ExecutorState finalState) {
        if (activeRun.compareAndSet(context, null)) {
            state.set(finalState);
        }
    }

    @Override
    public boolean stop() {
        WorkflowExecutionContext context = activeRun.get();
        if (context == null) {
            log.debug("[Workflow: '{}'] stop() called with no active run.", graph.getName());
            return false;
        }
        context.requestCancellation();
        if (activeRun.compareAndSet(context, null)) {
            state.set(ExecutorState.CANCELLED);
        }
        log.info("[RunId: {}][Workflow: '{}'] Run stopped. Executor is ready for a new run.",
                context.getRunId(), graph.getName());
        return true;
    }

    @Override
    public ExecutorState getState() {
        return state.get();
    }

    @Override
    public Flux<NodeProgressEvent> progressEvents() {
        return progressEvents.asFlux();
    }

    public WorkflowGraph getGraph() {
        return graph;
    }

    private void safeNotifyListeners(Consumer<WorkflowMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (WorkflowMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("工作流监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
