package xyz.vvrf.bimflow.core;

/**
 * 进度/状态侧通道。处理器通过它向节点的外部表示（如 UI 元数据存储）报告中间状态。
 * 写入是"发出即忘"的，引擎从不把这些值读回数据流。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface ProgressSink {

    /** 丢弃所有报告的通道 */
    ProgressSink NOOP = (nodeId, patch) -> { };

    /**
     * 报告一个节点的状态补丁。
     *
     * @param nodeId 节点 ID
     * @param patch  只包含需要更新字段的补丁
     */
    void report(String nodeId, NodeStatusPatch patch);
}
