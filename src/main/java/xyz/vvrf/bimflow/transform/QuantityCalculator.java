package xyz.vvrf.bimflow.transform;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.QuantityResult;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 从元素数量集中汇总数量。
 * <p>
 * 每个元素按数量集的顺序查找第一个非零值；找不到时使用该数量类型的默认值。
 * 结果保留两位小数。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class QuantityCalculator {

    public static final String GROUP_NONE = "none";

    private static final Map<String, List<String>> QTO_KEYS = new HashMap<>();
    private static final Map<String, Double> DEFAULT_VALUES = new HashMap<>();
    private static final Map<String, String> DEFAULT_UNITS = new HashMap<>();

    static {
        QTO_KEYS.put("length", Arrays.asList("Length", "Height", "Width", "Depth"));
        QTO_KEYS.put("area", Arrays.asList("Area", "NetArea", "GrossArea", "NetFloorArea", "GrossFloorArea"));
        QTO_KEYS.put("volume", Arrays.asList("Volume", "NetVolume", "GrossVolume"));
        QTO_KEYS.put("weight", Arrays.asList("Weight", "NetWeight", "GrossWeight"));

        DEFAULT_VALUES.put("length", 3.0);
        DEFAULT_VALUES.put("area", 10.0);
        DEFAULT_VALUES.put("volume", 8.0);
        DEFAULT_VALUES.put("weight", 500.0);
        DEFAULT_VALUES.put("count", 1.0);

        DEFAULT_UNITS.put("length", "m");
        DEFAULT_UNITS.put("area", "m²");
        DEFAULT_UNITS.put("volume", "m³");
        DEFAULT_UNITS.put("count", "");
        DEFAULT_UNITS.put("weight", "kg");
    }

    private QuantityCalculator() {}

    /**
     * @param quantityType length / area / volume / weight / count
     * @param groupBy      none / type / material / level
     * @param unit         显式单位；为空时使用数量类型的默认单位
     */
    public static QuantityResult calculate(List<BimElement> elements, String quantityType, String groupBy, String unit) {
        String finalUnit = unit != null && !unit.isEmpty() ? unit : defaultUnit(quantityType);
        if (elements == null || elements.isEmpty()) {
            log.debug("No elements for quantity extraction");
            return QuantityResult.zero(quantityType, finalUnit);
        }

        String grouping = groupBy != null ? groupBy : GROUP_NONE;
        Map<String, Double> groups = new LinkedHashMap<>();
        for (BimElement element : elements) {
            String key = GROUP_NONE.equals(grouping) ? QuantityResult.TOTAL : groupKey(element, grouping);
            groups.merge(key, quantityOf(element, quantityType), Double::sum);
        }
        groups.replaceAll((key, value) -> Elements.round(value, 2));

        log.debug("Quantities ({} by {}): {}", quantityType, grouping, groups);
        return QuantityResult.builder()
                .quantityType(quantityType)
                .unit(finalUnit)
                .groups(groups)
                .build();
    }

    public static String defaultUnit(String quantityType) {
        return DEFAULT_UNITS.getOrDefault(quantityType, "");
    }

    static double quantityOf(BimElement element, String quantityType) {
        if ("count".equals(quantityType)) {
            return 1.0;
        }
        List<String> keys = QTO_KEYS.getOrDefault(quantityType, Collections.emptyList());
        if (element.getQtos() != null) {
            for (Map<String, Object> qto : element.getQtos().values()) {
                if (qto == null) {
                    continue;
                }
                for (String key : keys) {
                    Double value = Elements.positiveNumber(qto.get(key));
                    if (value != null) {
                        return value;
                    }
                }
            }
        }
        return DEFAULT_VALUES.getOrDefault(quantityType, 0.0);
    }

    static String groupKey(BimElement element, String groupBy) {
        Map<String, Object> props = element.getProperties() != null ? element.getProperties() : Collections.emptyMap();
        switch (groupBy) {
            case "type":
                return stripIfcPrefix(element.getType());
            case "material":
                if (props.get("Material") != null) {
                    return String.valueOf(props.get("Material"));
                }
                Map<String, Object> material = element.getPsets() != null
                        ? element.getPsets().get("Pset_MaterialCommon") : null;
                if (material != null) {
                    Object name = material.get("Name");
                    return name != null ? String.valueOf(name) : "Unknown";
                }
                return "Unknown Material";
            case "level":
                if (props.get("Level") != null) {
                    return String.valueOf(props.get("Level"));
                }
                if (props.get("BuildingStorey") != null) {
                    return String.valueOf(props.get("BuildingStorey"));
                }
                return "Unknown Level";
            default:
                return "Unknown";
        }
    }

    private static String stripIfcPrefix(String type) {
        if (type == null) {
            return "Unknown";
        }
        return type.toUpperCase(Locale.ROOT).startsWith("IFC") ? type.substring(3) : type;
    }
}
