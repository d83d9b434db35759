package xyz.vvrf.bimflow.execution;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.ProgressSink;
import xyz.vvrf.bimflow.core.WorkflowGraph;
import xyz.vvrf.bimflow.monitor.WorkflowMonitorListener;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 为图快照创建执行器，共享同一个调度器、进度存储和监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowExecutorFactory {

    private final NodeDispatcher nodeDispatcher;
    private final ProgressSink defaultProgressSink;
    private final List<WorkflowMonitorListener> monitorListeners;

    public WorkflowExecutorFactory(NodeDispatcher nodeDispatcher,
                                   ProgressSink defaultProgressSink,
                                   List<WorkflowMonitorListener> monitorListeners) {
        this.nodeDispatcher = Objects.requireNonNull(nodeDispatcher, "Node dispatcher cannot be null");
        this.defaultProgressSink = defaultProgressSink != null ? defaultProgressSink : ProgressSink.NOOP;
        this.monitorListeners = monitorListeners != null ? monitorListeners : Collections.emptyList();
    }

    public WorkflowExecutor create(WorkflowGraph graph) {
        return create(graph, defaultProgressSink);
    }

    public WorkflowExecutor create(WorkflowGraph graph, ProgressSink progressSink) {
        log.debug("Creating executor for workflow '{}'", graph.getName());
        return new StandardWorkflowExecutor(graph, nodeDispatcher, progressSink, monitorListeners);
    }
}
