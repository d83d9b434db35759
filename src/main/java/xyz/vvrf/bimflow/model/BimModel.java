package xyz.vvrf.bimflow.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 已加载的 BIM 模型。加载失败或没有可用模型时 {@code errorMessage} 非空，元素列表为空。
 */
@Data
@Builder(toBuilder = true)
public class BimModel {

    private String id;
    private String name;
    private ModelSource source;
    private String schema;
    @Builder.Default
    private List<BimElement> elements = new ArrayList<>();
    private String errorMessage;

    public static BimModel empty(String errorMessage) {
        return BimModel.builder()
                .id("empty-model-" + UUID.randomUUID().toString().substring(0, 8))
                .name("No IFC Data")
                .errorMessage(errorMessage)
                .build();
    }

    public boolean hasError() {
        return errorMessage != null;
    }
}
