package xyz.vvrf.bimflow.execution;

import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.bimflow.core.NodeResult;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 一次运行的结果。{@link #getResults()} 按拓扑顺序排列，
 * 只包含实际执行过的节点（取消后未调度的节点不在其中）。
 *
 * @author ruifeng.wen
 */
@Getter
@ToString
public class WorkflowRunResult {

    private final String runId;
    private final String workflowName;
    private final RunStatus status;
    private final Map<String, NodeResult> results;
    private final Duration duration;

    public WorkflowRunResult(String runId, String workflowName, RunStatus status,
                             Map<String, NodeResult> results, Duration duration) {
        this.runId = runId;
        this.workflowName = workflowName;
        this.status = status;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.duration = duration;
    }

    public Optional<NodeResult> getResult(String nodeId) {
        return Optional.ofNullable(results.get(nodeId));
    }

    /**
     * @return 节点结果的值；节点未执行或结果为空时返回 Optional.empty()
     */
    public Optional<Object> getValue(String nodeId) {
        return getResult(nodeId).flatMap(NodeResult::getValue);
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
