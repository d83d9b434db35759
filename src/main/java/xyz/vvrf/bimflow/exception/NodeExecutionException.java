package xyz.vvrf.bimflow.exception;

import lombok.Getter;

/**
 * 节点处理器抛出异常。对整个运行是致命的，原始异常作为 cause 保留。
 */
@Getter
public class NodeExecutionException extends WorkflowException {

    private final String nodeId;
    private final String kind;

    public NodeExecutionException(String nodeId, String kind, Throwable cause) {
        super(String.format("Node '%s' (kind: %s) failed: %s", nodeId, kind,
                cause != null ? cause.getMessage() : "unknown error"), cause);
        this.nodeId = nodeId;
        this.kind = kind;
    }
}
