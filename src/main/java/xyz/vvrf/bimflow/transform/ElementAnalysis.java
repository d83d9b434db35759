package xyz.vvrf.bimflow.transform;

import xyz.vvrf.bimflow.model.BimElement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 不依赖几何能力的分析：空间指标和基于包围盒的相邻关系。
 *
 * @author ruifeng.wen
 */
public final class ElementAnalysis {

    private static final double DEFAULT_SPACE_AREA = 20;
    private static final double DEFAULT_SPACE_VOLUME = 60;
    private static final double AREA_PER_OCCUPANT = 10;

    private ElementAnalysis() {}

    /**
     * 汇总面积和体积。没有数量集的空间使用默认面积 20 m² 和体积 60 m³。
     *
     * @param metric area / volume / occupancy
     * @return 指标结果；未知指标返回 null
     */
    public static Map<String, Object> spatialMetrics(List<BimElement> elements, String metric) {
        double totalArea = 0;
        double totalVolume = 0;
        for (BimElement element : elements) {
            if (element.getQtos() != null && !element.getQtos().isEmpty()) {
                for (Map<String, Object> qto : element.getQtos().values()) {
                    Double area = first(qto, "Area", "NetArea", "GrossArea");
                    Double volume = first(qto, "Volume", "NetVolume", "GrossVolume");
                    totalArea += area != null ? area : 0;
                    totalVolume += volume != null ? volume : 0;
                }
            } else if (element.getType() != null && element.getType().toUpperCase().contains("IFCSPACE")) {
                totalArea += DEFAULT_SPACE_AREA;
                totalVolume += DEFAULT_SPACE_VOLUME;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        int count = elements.size();
        switch (metric != null ? metric : "area") {
            case "area":
                result.put("totalArea", Elements.round(totalArea, 2));
                result.put("areaPerElement", Elements.round(totalArea / count, 2));
                return result;
            case "volume":
                result.put("totalVolume", Elements.round(totalVolume, 2));
                result.put("volumePerElement", Elements.round(totalVolume / count, 2));
                return result;
            case "occupancy":
                int occupancy = (int) Math.floor(totalArea / AREA_PER_OCCUPANT);
                result.put("occupancy", occupancy);
                result.put("density", totalArea > 0 ? Elements.round(occupancy / totalArea, 4) : 0.0);
                return result;
            default:
                return null;
        }
    }

    /**
     * 每个元素在容差内相邻 (接触或相交) 的其他元素数量。
     */
    public static Map<String, Object> adjacency(List<BimElement> elements, double tolerance) {
        Map<String, Integer> adjacentCounts = new LinkedHashMap<>();
        int total = 0;
        for (BimElement element : elements) {
            int adjacent = 0;
            if (element.getBoundingBox() != null) {
                for (BimElement other : elements) {
                    if (other != element && other.getBoundingBox() != null
                            && element.getBoundingBox().distanceTo(other.getBoundingBox()) <= tolerance) {
                        adjacent++;
                    }
                }
            }
            adjacentCounts.put(element.getId(), adjacent);
            total += adjacent;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalElements", elements.size());
        result.put("adjacency", adjacentCounts);
        result.put("averageAdjacency", elements.isEmpty() ? 0.0 : Elements.round((double) total / elements.size(), 2));
        return result;
    }

    private static Double first(Map<String, Object> qto, String... keys) {
        if (qto == null) {
            return null;
        }
        for (String key : keys) {
            Double value = Elements.positiveNumber(qto.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
