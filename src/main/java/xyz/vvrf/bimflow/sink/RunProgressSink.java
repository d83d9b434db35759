package xyz.vvrf.bimflow.sink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Sinks;
import xyz.vvrf.bimflow.core.NodeStatusPatch;
import xyz.vvrf.bimflow.core.ProgressSink;

import java.time.Instant;
import java.util.Objects;

/**
 * 一次运行使用的进度通道：把补丁发布到执行器的事件流，再转发给外部存储。
 * 任何一侧的失败都只记录日志，不影响运行。
 * <p>
 * 同一执行器的所有运行共享一个事件流，被停止的运行与新运行可能同时报告进度，
 * 因此发布在执行器级别的 {@code emitLock} 上串行化。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class RunProgressSink implements ProgressSink {

    private final String runId;
    private final String workflowName;
    private final ProgressSink delegate;
    private final Sinks.Many<NodeProgressEvent> events;
    private final Object emitLock;

    /**
     * @param events   执行器的事件流 (不能为空)
     * @param emitLock 与 events 一一对应的锁，所有向 events 发布的运行必须共用 (不能为空)
     */
    public RunProgressSink(String runId, String workflowName, ProgressSink delegate,
                           Sinks.Many<NodeProgressEvent> events, Object emitLock) {
        this.runId = Objects.requireNonNull(runId, "Run id cannot be null");
        this.workflowName = workflowName;
        this.delegate = delegate != null ? delegate : ProgressSink.NOOP;
        this.events = Objects.requireNonNull(events, "Event sink cannot be null");
        this.emitLock = Objects.requireNonNull(emitLock, "Emit lock cannot be null");
    }

    @Override
    public void report(String nodeId, NodeStatusPatch patch) {
        if (nodeId == null || patch == null) {
            log.warn("[RunId: {}][Workflow: '{}'] Ignoring progress report with null node id or patch.", runId, workflowName);
            return;
        }
        emit(NodeProgressEvent.builder()
                .runId(runId)
                .workflowName(workflowName)
                .nodeId(nodeId)
                .patch(patch)
                .timestamp(Instant.now())
                .build());
        try {
            delegate.report(nodeId, patch);
        } catch (Exception e) {
            log.warn("[RunId: {}][Workflow: '{}'] Progress sink failed for node '{}': {}",
                    runId, workflowName, nodeId, e.getMessage(), e);
        }
    }

    private void emit(NodeProgressEvent event) {
        Sinks.EmitResult result;
        synchronized (emitLock) {
            result = events.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("[RunId: {}][Workflow: '{}'] Failed to emit progress event for node '{}': {}",
                    runId, workflowName, event.getNodeId(), result);
        }
    }
}
