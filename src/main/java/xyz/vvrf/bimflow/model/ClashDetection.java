package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 几何能力返回的原始碰撞结果，元素以 expressId 标识。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClashDetection {

    private int clashes;
    private List<Pair> details = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pair {
        private String id;
        private Integer element1Id;
        private Integer element2Id;
        private double distance;
    }
}
