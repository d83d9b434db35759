package xyz.vvrf.bimflow.core;

import java.util.Objects;

/**
 * 工作流中连接边的定义（不可变数据类）。
 * 从源节点的输出端口指向目标节点的输入端口。
 * 端口为空时分别使用 {@link Ports#OUTPUT} 和 {@link Ports#INPUT}。
 *
 * @author ruifeng.wen
 */
public final class EdgeDefinition {
    private final String sourceNodeId;
    private final String sourcePort;
    private final String targetNodeId;
    private final String targetPort;

    /**
     * 创建一个边的定义。
     *
     * @param sourceNodeId 源节点 ID (不能为空)
     * @param sourcePort   源输出端口 (可为空)
     * @param targetNodeId 目标节点 ID (不能为空)
     * @param targetPort   目标输入端口 (可为空)
     */
    public EdgeDefinition(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        this.sourceNodeId = Objects.requireNonNull(sourceNodeId, "Source node id cannot be null");
        this.targetNodeId = Objects.requireNonNull(targetNodeId, "Target node id cannot be null");
        this.sourcePort = Ports.orDefault(sourcePort, Ports.OUTPUT);
        this.targetPort = Ports.orDefault(targetPort, Ports.INPUT);
    }

    public static EdgeDefinition of(String sourceNodeId, String targetNodeId) {
        return new EdgeDefinition(sourceNodeId, null, targetNodeId, null);
    }

    public static EdgeDefinition of(String sourceNodeId, String targetNodeId, String targetPort) {
        return new EdgeDefinition(sourceNodeId, null, targetNodeId, targetPort);
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public String getSourcePort() {
        return sourcePort;
    }

    public String getTargetNodeId() {
        return targetNodeId;
    }

    public String getTargetPort() {
        return targetPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeDefinition that = (EdgeDefinition) o;
        return sourceNodeId.equals(that.sourceNodeId) &&
                sourcePort.equals(that.sourcePort) &&
                targetNodeId.equals(that.targetNodeId) &&
                targetPort.equals(that.targetPort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceNodeId, sourcePort, targetNodeId, targetPort);
    }

    @Override
    public String toString() {
        return String.format("Edge[%s(%s) -> %s(%s)]", sourceNodeId, sourcePort, targetNodeId, targetPort);
    }
}
