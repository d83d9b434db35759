package xyz.vvrf.bimflow.exception;

import lombok.Getter;

/**
 * 边引用了图中不存在的节点 ID。属于配置错误。
 */
@Getter
public class UnknownNodeReferenceException extends WorkflowException {

    private final String nodeId;

    public UnknownNodeReferenceException(String workflowName, String nodeId, String edgeDescription) {
        super(String.format("Workflow '%s': %s references non-existent node '%s'.",
                workflowName, edgeDescription, nodeId));
        this.nodeId = nodeId;
    }
}
