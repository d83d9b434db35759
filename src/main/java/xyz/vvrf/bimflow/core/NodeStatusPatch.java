package xyz.vvrf.bimflow.core;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 节点 UI 元数据的部分更新。为 null 的字段表示"不变"。
 * {@code clearProgress} 为 true 时表示清除进度信息。
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class NodeStatusPatch {

    private final Boolean loading;
    private final Integer progressPercentage;
    private final String progressMessage;
    private final boolean clearProgress;
    private final String error;
    private final String correlationId;
    private final Object inputData;

    public static NodeStatusPatch progress(int percentage, String message) {
        return NodeStatusPatch.builder()
                .loading(true)
                .progressPercentage(Math.max(0, Math.min(100, percentage)))
                .progressMessage(message != null ? message : "Processing...")
                .build();
    }

    public static NodeStatusPatch finished() {
        return NodeStatusPatch.builder()
                .loading(false)
                .clearProgress(true)
                .build();
    }

    public static NodeStatusPatch failed(String error) {
        return NodeStatusPatch.builder()
                .loading(false)
                .clearProgress(true)
                .error(error)
                .build();
    }
}
