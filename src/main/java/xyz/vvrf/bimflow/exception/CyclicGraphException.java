package xyz.vvrf.bimflow.exception;

import lombok.Getter;

/**
 * 工作流图包含环。由拓扑排序在任何节点执行之前抛出。
 */
@Getter
public class CyclicGraphException extends WorkflowException {

    private final String workflowName;
    private final String fromNodeId;
    private final String toNodeId;

    public CyclicGraphException(String workflowName, String fromNodeId, String toNodeId) {
        super(String.format("Workflow '%s' contains a cycle, cannot execute. Cycle closes on edge '%s' -> '%s'.",
                workflowName, fromNodeId, toNodeId));
        this.workflowName = workflowName;
        this.fromNodeId = fromNodeId;
        this.toNodeId = toNodeId;
    }
}
