package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 分析节点的碰撞报告：原始碰撞结果中的 expressId 已解析为元素摘要。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClashReport {

    private int clashes;
    private List<Detail> details = new ArrayList<>();
    private boolean completed;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Detail {
        private String id;
        private ElementSummary element1;
        private ElementSummary element2;
        private double distance;
    }

    /**
     * 碰撞中的元素。找不到对应元素时只有 expressId。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ElementSummary {
        private Integer expressId;
        private String type;
        private String name;
    }
}
