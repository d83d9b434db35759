package xyz.vvrf.bimflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInputs;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.WorkflowGraph;
import xyz.vvrf.bimflow.exception.NodeExecutionException;
import xyz.vvrf.bimflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.bimflow.registry.NodeHandlerRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 标准节点调度器。
 * <p>
 * 同步处理器在订阅线程上执行；声明为 {@link ExecutionMode#ASYNC} 的处理器在给定的 Scheduler 上订阅。
 * 处理器返回空 Mono 时得到空结果；处理器抛出或发出的错误被包装为 {@link NodeExecutionException}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardNodeDispatcher implements NodeDispatcher {

    private final NodeHandlerRegistry handlerRegistry;
    private final Scheduler asyncScheduler;
    private final List<WorkflowMonitorListener> monitorListeners;

    /**
     * @param handlerRegistry  处理器注册表 (不能为空)
     * @param asyncScheduler   异步处理器使用的调度器 (不能为空)
     * @param monitorListeners 监听器列表 (可为 null)
     */
    public StandardNodeDispatcher(NodeHandlerRegistry handlerRegistry,
                                  Scheduler asyncScheduler,
                                  List<WorkflowMonitorListener> monitorListeners) {
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "Handler registry cannot be null");
        this.asyncScheduler = Objects.requireNonNull(asyncScheduler, "Async scheduler cannot be null");
        this.monitorListeners = monitorListeners != null
                ? new CopyOnWriteArrayList<>(monitorListeners)
                : Collections.emptyList();
        log.info("StandardNodeDispatcher 初始化完成。Registered kinds: {}, Async scheduler: {}, Listeners: {}",
                handlerRegistry.getRegisteredKinds().size(), asyncScheduler, this.monitorListeners.size());
    }

    @Override
    public Map<String, NodeHandler> bindHandlers(WorkflowGraph graph) {
        Map<String, NodeHandler> bindings = new HashMap<>();
        for (NodeDefinition node : graph.getNodes()) {
            String kind = node.getKind();
            if (bindings.containsKey(kind)) {
                continue;
            }
            NodeHandler handler = handlerRegistry.getHandler(kind).orElse(null);
            if (handler != null) {
                bindings.put(kind, handler);
            } else {
                log.debug("Workflow '{}': no handler registered for kind '{}' (node '{}').",
                        graph.getName(), kind, node.getId());
            }
        }
        return bindings;
    }

    @Override
    public Mono<NodeResult> dispatch(NodeDefinition node, NodeInputs inputs, WorkflowExecutionContext context) {
        final String runId = context.getRunId();
        final String workflowName = context.getWorkflowName();
        final String nodeId = node.getId();
        final String kind = node.getKind();

        return Mono.defer(() -> {
            NodeHandler handler = context.getHandler(kind).orElse(null);
            if (handler == null) {
                log.warn("[RunId: {}][Workflow: '{}'] Unknown node kind '{}' for node '{}', producing empty result.",
                        runId, workflowName, kind, nodeId);
                safeNotifyListeners(l -> l.onUnknownKind(runId, workflowName, nodeId, kind));
                return Mono.just(NodeResult.empty());
            }

            NodeInvocation invocation = NodeInvocation.builder()
                    .node(node)
                    .inputs(inputs)
                    .sink(context.getProgressSink())
                    .cancellationToken(context.getCancellationToken())
                    .runId(runId)
                    .build();

            Instant startTime = Instant.now();
            safeNotifyListeners(l -> l.onNodeStart(runId, workflowName, nodeId, kind));
            log.debug("[RunId: {}][Workflow: '{}'] Dispatching node '{}' (kind: {}, handler: {}, mode: {}, inputs: {})",
                    runId, workflowName, nodeId, kind, handler.getClass().getSimpleName(),
                    handler.getExecutionMode(), inputs.getConnectedPorts());

            Mono<NodeResult> execution = Mono.defer(() -> handler.execute(invocation));
            if (handler.getExecutionMode() == ExecutionMode.ASYNC) {
                execution = execution.subscribeOn(asyncScheduler);
            }

            return execution
                    .defaultIfEmpty(NodeResult.empty())
                    .doOnNext(result -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        if (result.isSoftError()) {
                            log.info("[RunId: {}][Workflow: '{}'] Node '{}' completed with soft error in {}ms.",
                                    runId, workflowName, nodeId, duration.toMillis());
                        } else {
                            log.debug("[RunId: {}][Workflow: '{}'] Node '{}' completed in {}ms.",
                                    runId, workflowName, nodeId, duration.toMillis());
                        }
                        safeNotifyListeners(l -> l.onNodeSuccess(runId, workflowName, nodeId, kind, duration, result));
                    })
                    .onErrorMap(e -> !(e instanceof NodeExecutionException), e -> new NodeExecutionException(nodeId, kind, e))
                    .doOnError(e -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        log.error("[RunId: {}][Workflow: '{}'] Node '{}' failed after {}ms: {}",
                                runId, workflowName, nodeId, duration.toMillis(), e.getMessage());
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        safeNotifyListeners(l -> l.onNodeFailure(runId, workflowName, nodeId, kind, duration, cause));
                    });
        });
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
