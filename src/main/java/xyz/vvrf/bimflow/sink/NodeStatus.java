package xyz.vvrf.bimflow.sink;

import lombok.Builder;
import lombok.Data;
import xyz.vvrf.bimflow.core.NodeStatusPatch;

import java.time.Instant;

/**
 * 单个节点合并后的 UI 元数据。与图描述分离，只通过进度通道更新。
 */
@Data
@Builder(toBuilder = true)
public class NodeStatus {
    private String nodeId;
    private boolean loading;
    private Integer progressPercentage;
    private String progressMessage;
    private String error;
    private String correlationId;
    private Object inputData;
    private Instant updatedAt;

    public static NodeStatus initial(String nodeId) {
        return NodeStatus.builder().nodeId(nodeId).updatedAt(Instant.now()).build();
    }

    /**
     * 把补丁合并到当前状态，返回新状态。补丁中为 null 的字段保持不变。
     */
    public NodeStatus apply(NodeStatusPatch patch) {
        NodeStatusBuilder next = toBuilder().updatedAt(Instant.now());
        if (patch.getLoading() != null) {
            next.loading(patch.getLoading());
        }
        if (patch.isClearProgress()) {
            next.progressPercentage(null).progressMessage(null);
        }
        if (patch.getProgressPercentage() != null) {
            next.progressPercentage(patch.getProgressPercentage());
        }
        if (patch.getProgressMessage() != null) {
            next.progressMessage(patch.getProgressMessage());
        }
        if (patch.getError() != null) {
            next.error(patch.getError());
        } else if (Boolean.TRUE.equals(patch.getLoading())) {
            // 重新开始加载时清除旧错误
            next.error(null);
        }
        if (patch.getCorrelationId() != null) {
            next.correlationId(patch.getCorrelationId());
        }
        if (patch.getInputData() != null) {
            next.inputData(patch.getInputData());
        }
        return next.build();
    }
}
