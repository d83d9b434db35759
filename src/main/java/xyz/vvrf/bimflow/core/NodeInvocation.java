package xyz.vvrf.bimflow.core;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * 一次处理器调用的全部参数：节点定义、已解析的输入、进度通道和取消令牌。
 */
@Getter
@Builder
public class NodeInvocation {

    @NonNull
    private final NodeDefinition node;
    @NonNull
    @Builder.Default
    private final NodeInputs inputs = NodeInputs.none();
    @NonNull
    @Builder.Default
    private final ProgressSink sink = ProgressSink.NOOP;
    @NonNull
    @Builder.Default
    private final CancellationToken cancellationToken = CancellationToken.NONE;
    private final String runId;

    public String getNodeId() {
        return node.getId();
    }

    /**
     * 以本节点 ID 报告状态补丁。
     */
    public void report(NodeStatusPatch patch) {
        sink.report(node.getId(), patch);
    }

    public void reportProgress(int percentage, String message) {
        report(NodeStatusPatch.progress(percentage, message));
    }

    /**
     * 将外部协作者的进度回调桥接到本节点的进度通道。
     */
    public ProgressCallback progressCallback() {
        return this::reportProgress;
    }

    public boolean isCancellationRequested() {
        return cancellationToken.isCancellationRequested();
    }
}
