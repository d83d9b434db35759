package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数量统计结果：分组键 -> 数值 (保留两位小数)。不分组时只有一个 {@code Total} 键。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuantityResult {

    public static final String TOTAL = "Total";

    private String quantityType;
    private String unit;
    @Builder.Default
    private Map<String, Double> groups = new LinkedHashMap<>();

    public static QuantityResult zero(String quantityType, String unit) {
        Map<String, Double> groups = new LinkedHashMap<>();
        groups.put(TOTAL, 0.0);
        return new QuantityResult(quantityType, unit, groups);
    }

    public double getTotal() {
        return groups.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
