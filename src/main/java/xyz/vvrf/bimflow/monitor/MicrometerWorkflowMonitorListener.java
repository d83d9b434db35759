package xyz.vvrf.bimflow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.execution.RunStatus;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerWorkflowMonitorListener implements WorkflowMonitorListener {

    // 指标名称
    public static final String METRIC_NODE_EXECUTION_TIME = "bimflow.node.execution.time";
    public static final String METRIC_NODE_EXECUTION_TOTAL = "bimflow.node.execution.total";
    public static final String METRIC_RUN_EXECUTION_TIME = "bimflow.run.execution.time";

    // 标签键
    private static final String TAG_WORKFLOW_NAME = "workflow.name";
    private static final String TAG_NODE_KIND = "node.kind";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_SOFT_ERROR = "SOFT_ERROR";
    private static final String STATUS_FAILURE = "FAILURE";
    private static final String STATUS_SKIPPED = "SKIPPED";
    private static final String STATUS_UNKNOWN_KIND = "UNKNOWN_KIND";

    private final MeterRegistry meterRegistry;

    public MicrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");
    }

    @Override
    public void onNodeSuccess(String runId, String workflowName, String nodeId, String kind,
                              Duration duration, NodeResult result) {
        Tags tags = nodeTags(workflowName, kind, result.isSoftError() ? STATUS_SOFT_ERROR : STATUS_SUCCESS);
        recordTimer(METRIC_NODE_EXECUTION_TIME, "工作流节点执行时间", tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onNodeFailure(String runId, String workflowName, String nodeId, String kind,
                              Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        Tags tags = nodeTags(workflowName, kind, STATUS_FAILURE).and(Tag.of(TAG_ERROR, errorTagValue));
        recordTimer(METRIC_NODE_EXECUTION_TIME, "工作流节点执行时间", tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onNodeSkipped(String runId, String workflowName, String nodeId, String kind) {
        incrementCounter(nodeTags(workflowName, kind, STATUS_SKIPPED));
    }

    @Override
    public void onUnknownKind(String runId, String workflowName, String nodeId, String kind) {
        incrementCounter(nodeTags(workflowName, kind, STATUS_UNKNOWN_KIND));
    }

    @Override
    public void onRunComplete(String runId, String workflowName, Duration totalDuration, RunStatus status,
                              Map<String, NodeResult> results, Throwable error) {
        Tags tags = Tags.of(Tag.of(TAG_WORKFLOW_NAME, workflowName), Tag.of(TAG_STATUS, status.name()));
        recordTimer(METRIC_RUN_EXECUTION_TIME, "工作流运行总时间", tags, totalDuration);
    }

    private Tags nodeTags(String workflowName, String kind, String status) {
        return Tags.of(
                Tag.of(TAG_WORKFLOW_NAME, workflowName),
                Tag.of(TAG_NODE_KIND, kind),
                Tag.of(TAG_STATUS, status)
        );
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_NODE_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("工作流节点执行次数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
