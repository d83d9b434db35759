package xyz.vvrf.bimflow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.WorkflowGraph;
import xyz.vvrf.bimflow.execution.RunStatus;

import java.time.Duration;
import java.util.Map;

@Slf4j
public class LoggingWorkflowMonitorListener implements WorkflowMonitorListener {

    @Override
    public void onRunStart(String runId, String workflowName, WorkflowGraph graph) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 开始。 节点数:[{}], 边数:[{}]",
                runId, workflowName, graph.size(), graph.getEdges().size());
    }

    @Override
    public void onRunComplete(String runId, String workflowName, Duration totalDuration, RunStatus status,
                              Map<String, NodeResult> results, Throwable error) {
        if (status == RunStatus.ABORTED) {
            log.error("[MONITOR] 运行:[{}] 工作流:[{}] 中止。 耗时:[{}ms], 错误:[{}]",
                    runId, workflowName, totalDuration.toMillis(), error != null ? error.getMessage() : "unknown");
        } else {
            log.info("[MONITOR] 运行:[{}] 工作流:[{}] 结束。 状态:[{}], 耗时:[{}ms], 结果数:[{}]",
                    runId, workflowName, status, totalDuration.toMillis(), results.size());
        }
    }

    @Override
    public void onNodeStart(String runId, String workflowName, String nodeId, String kind) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 开始。 类型:[{}]", runId, workflowName, nodeId, kind);
    }

    @Override
    public void onNodeSuccess(String runId, String workflowName, String nodeId, String kind,
                              Duration duration, NodeResult result) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 成功。 耗时:[{}ms], 结果为空:[{}], 软错误:[{}]",
                runId, workflowName, nodeId, duration.toMillis(), result.isEmpty(), result.isSoftError());
    }

    @Override
    public void onNodeFailure(String runId, String workflowName, String nodeId, String kind,
                              Duration duration, Throwable error) {
        log.error("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类型:[{}]",
                runId, workflowName, nodeId, duration.toMillis(), error.getMessage(), kind, error);
    }

    @Override
    public void onNodeSkipped(String runId, String workflowName, String nodeId, String kind) {
        log.info("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 跳过 (已取消)。 类型:[{}]", runId, workflowName, nodeId, kind);
    }

    @Override
    public void onUnknownKind(String runId, String workflowName, String nodeId, String kind) {
        log.warn("[MONITOR] 运行:[{}] 工作流:[{}] 节点:[{}] 类型未注册:[{}]，结果为空。", runId, workflowName, nodeId, kind);
    }
}
