package xyz.vvrf.bimflow.sink;

import lombok.Builder;
import lombok.Data;
import xyz.vvrf.bimflow.core.NodeStatusPatch;

import java.time.Instant;

/**
 * 执行器事件流中的一条进度事件。
 */
@Data
@Builder
public class NodeProgressEvent {
    private String runId;
    private String workflowName;
    private String nodeId;
    private NodeStatusPatch patch;
    private Instant timestamp;
}
