package xyz.vvrf.bimflow.monitor;

import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.WorkflowGraph;
import xyz.vvrf.bimflow.execution.RunStatus;

import java.time.Duration;
import java.util.Map;

/**
 * 用于监控工作流执行事件的监听器接口。
 * 包括运行级别和节点级别的事件。所有方法都有空的默认实现。
 * 监听器抛出的异常会被记录并忽略，不会影响运行。
 *
 * @author ruifeng.wen
 */
public interface WorkflowMonitorListener {

    /**
     * 运行开始时调用（拓扑排序成功之后）。
     *
     * @param runId        运行 ID
     * @param workflowName 工作流名称
     * @param graph        图快照
     */
    default void onRunStart(String runId, String workflowName, WorkflowGraph graph) {
    }

    /**
     * 运行结束时调用（无论成功、取消或中止）。
     *
     * @param runId         运行 ID
     * @param workflowName  工作流名称
     * @param totalDuration 运行总耗时
     * @param status        最终状态
     * @param results       已缓存的结果 (中止时为空 Map)
     * @param error         中止原因；未中止时为 null
     */
    default void onRunComplete(String runId, String workflowName, Duration totalDuration, RunStatus status,
                               Map<String, NodeResult> results, Throwable error) {
    }

    /**
     * 节点处理器开始执行时调用。
     */
    default void onNodeStart(String runId, String workflowName, String nodeId, String kind) {
    }

    /**
     * 节点处理器成功返回时调用。
     */
    default void onNodeSuccess(String runId, String workflowName, String nodeId, String kind,
                               Duration duration, NodeResult result) {
    }

    /**
     * 节点处理器失败时调用。
     */
    default void onNodeFailure(String runId, String workflowName, String nodeId, String kind,
                               Duration duration, Throwable error) {
    }

    /**
     * 节点因运行被取消而未调度时调用。
     */
    default void onNodeSkipped(String runId, String workflowName, String nodeId, String kind) {
    }

    /**
     * 节点类型没有注册处理器时调用，该节点得到空结果。
     */
    default void onUnknownKind(String runId, String workflowName, String nodeId, String kind) {
    }
}
