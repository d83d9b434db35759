package xyz.vvrf.bimflow.execution;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.core.CancellationToken;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.ProgressSink;
import xyz.vvrf.bimflow.core.WorkflowGraph;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 封装单次工作流运行的上下文和运行时状态。
 * 每次 {@link WorkflowExecutor#execute()} 调用都会创建一个新实例，运行结束后丢弃，
 * 新的运行从不复用之前的缓存。
 * <p>
 * 记忆化缓存使用无界的 Caffeine Cache：节点 ID 到 {@code .cache()} 过的执行 Mono，
 * 保证每个节点在一次运行中最多求值一次。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public class WorkflowExecutionContext {

    private final String runId;
    private final WorkflowGraph graph;
    private final String workflowName;
    private final Instant startTime;
    private final ProgressSink progressSink;
    private final CancellationToken cancellationToken;

    @Getter(AccessLevel.NONE)
    private final Map<String, NodeHandler> handlerBindings;
    @Getter(AccessLevel.NONE)
    private final Cache<String, Mono<NodeResult>> nodeExecutionMonos = Caffeine.newBuilder().build();
    @Getter(AccessLevel.NONE)
    private final Map<String, NodeResult> completedResults = new ConcurrentHashMap<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, NodeState> nodeStates = new ConcurrentHashMap<>();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final AtomicInteger completedNodeCounter = new AtomicInteger(0);

    private volatile List<String> executionOrder = Collections.emptyList();

    /**
     * @param graph           图快照
     * @param handlerBindings 本次运行解析好的 kind -> 处理器绑定
     * @param progressSink    本次运行的进度通道
     */
    public WorkflowExecutionContext(WorkflowGraph graph, Map<String, NodeHandler> handlerBindings, ProgressSink progressSink) {
        this(newRunId(), graph, handlerBindings, progressSink);
    }

    public WorkflowExecutionContext(String runId, WorkflowGraph graph, Map<String, NodeHandler> handlerBindings,
                                    ProgressSink progressSink) {
        this.runId = (runId != null && !runId.trim().isEmpty()) ? runId : newRunId();
        this.graph = graph;
        this.workflowName = graph.getName();
        this.startTime = Instant.now();
        this.handlerBindings = Collections.unmodifiableMap(new LinkedHashMap<>(handlerBindings));
        this.progressSink = progressSink != null ? progressSink : ProgressSink.NOOP;
        this.cancellationToken = cancellationRequested::get;
        graph.getNodeIds().forEach(id -> nodeStates.put(id, NodeState.PENDING));

        log.debug("[RunId: {}][Workflow: '{}'] Created WorkflowExecutionContext (Nodes: {}, Bound kinds: {})",
                this.runId, workflowName, graph.size(), this.handlerBindings.keySet());
    }

    public static String newRunId() {
        return "flow-run-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public Optional<NodeHandler> getHandler(String kind) {
        return Optional.ofNullable(handlerBindings.get(kind));
    }

    /**
     * 获取或创建指定节点的执行 Mono。每个节点只创建一次。
     *
     * @param nodeId       节点 ID
     * @param monoSupplier 仅当 Mono 不存在时调用，只能构造 Mono，不得订阅
     */
    public Mono<NodeResult> getOrCreateNodeMono(String nodeId, Supplier<Mono<NodeResult>> monoSupplier) {
        return nodeExecutionMonos.get(nodeId, key -> {
            log.trace("[RunId: {}][Workflow: '{}'] Creating execution Mono for node '{}'.", runId, workflowName, nodeId);
            return monoSupplier.get();
        });
    }

    /**
     * 原子性地记录一个节点的结果。
     *
     * @return 如果结果是新记录的，则返回 true；如果该节点已有结果则返回 false
     */
    public boolean recordCompletedResult(String nodeId, NodeResult result) {
        if (completedResults.putIfAbsent(nodeId, result) == null) {
            nodeStates.put(nodeId, NodeState.CACHED);
            int count = completedNodeCounter.incrementAndGet();
            log.debug("[RunId: {}][Workflow: '{}'] Node '{}' cached. Progress: {}/{}",
                    runId, workflowName, nodeId, count, graph.size());
            return true;
        }
        log.warn("[RunId: {}][Workflow: '{}'] Node '{}' result ALREADY recorded. This might indicate an issue.",
                runId, workflowName, nodeId);
        return false;
    }

    public Optional<NodeResult> getCompletedResult(String nodeId) {
        return Optional.ofNullable(completedResults.get(nodeId));
    }

    public void markNodeState(String nodeId, NodeState state) {
        NodeState previous = nodeStates.put(nodeId, state);
        log.trace("[RunId: {}][Workflow: '{}'] Node '{}' {} -> {}", runId, workflowName, nodeId, previous, state);
    }

    public NodeState getNodeState(String nodeId) {
        return nodeStates.getOrDefault(nodeId, NodeState.PENDING);
    }

    /**
     * 请求协作式取消。
     *
     * @return 如果是首次请求，则返回 true
     */
    public boolean requestCancellation() {
        if (cancellationRequested.compareAndSet(false, true)) {
            log.info("[RunId: {}][Workflow: '{}'] Cancellation requested. No further nodes will be dispatched.",
                    runId, workflowName);
            return true;
        }
        return false;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    public int getCompletedNodeCount() {
        return completedNodeCounter.get();
    }

    void setExecutionOrder(List<String> executionOrder) {
        this.executionOrder = Collections.unmodifiableList(executionOrder);
    }

    /**
     * 按执行顺序返回已缓存的结果。
     */
    public Map<String, NodeResult> getResultsInOrder() {
        Map<String, NodeResult> ordered = new LinkedHashMap<>();
        for (String nodeId : executionOrder) {
            NodeResult result = completedResults.get(nodeId);
            if (result != null) {
                ordered.put(nodeId, result);
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    /**
     * 丢弃此上下文持有的缓存和结果。运行结束（无论成功与否）后调用。
     */
    public void discard() {
        log.debug("[RunId: {}][Workflow: '{}'] Discarding run context caches.", runId, workflowName);
        nodeExecutionMonos.invalidateAll();
        completedResults.clear();
    }
}
