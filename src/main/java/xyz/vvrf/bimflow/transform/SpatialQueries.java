package xyz.vvrf.bimflow.transform;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.BoundingBox;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;

/**
 * 相对参考元素的空间查询。
 * <p>
 * 参考元素中有空间结构元素 (楼层、建筑等) 时，contained/containing 按元素所在楼层判断；
 * 否则以及其他查询类型都按包围盒判断，没有包围盒的元素不会命中。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class SpatialQueries {

    public static final String STOREY = "IFCBUILDINGSTOREY";
    public static final String BUILDING = "IFCBUILDING";

    private static final List<String> SPATIAL_TYPES =
            Arrays.asList("IFCPROJECT", "IFCSITE", BUILDING, STOREY, "IFCSPACE");
    private static final double TOUCH_TOLERANCE = 1e-3;

    private SpatialQueries() {}

    public static List<BimElement> query(List<BimElement> elements, List<BimElement> reference,
                                         String queryType, double distance) {
        if (elements == null || elements.isEmpty()) {
            log.debug("No elements for spatial query");
            return Collections.emptyList();
        }
        if (reference == null || reference.isEmpty()) {
            log.debug("No reference elements for spatial query");
            return Collections.emptyList();
        }
        boolean spatialReference = reference.stream().anyMatch(SpatialQueries::isSpatialElement);

        switch (queryType != null ? queryType : "contained") {
            case "contained":
                return spatialReference
                        ? byStorey(elements, reference, true)
                        : byBox(elements, reference, (box, ref) -> ref.contains(box));
            case "containing":
                return spatialReference
                        ? byStorey(elements, reference, false)
                        : byBox(elements, reference, BoundingBox::contains);
            case "intersecting":
                return byBox(elements, reference, BoundingBox::intersects);
            case "touching":
                return byBox(elements, reference, (box, ref) -> box.touches(ref, TOUCH_TOLERANCE));
            case "within-distance":
                return byBox(elements, reference, (box, ref) -> box.distanceTo(ref) <= distance);
            default:
                log.warn("Unknown spatial query type '{}', returning input unchanged", queryType);
                return new ArrayList<>(elements);
        }
    }

    public static boolean isSpatialElement(BimElement element) {
        return element.getType() != null && SPATIAL_TYPES.contains(element.getType().toUpperCase(Locale.ROOT));
    }

    /**
     * 元素所在楼层：先看直接属性 BuildingStorey，再看 Pset_SpaceLevelInfo.Reference，
     * 最后看任一属性集中的 Level / StoreyName / BuildingStorey。
     */
    public static String containingStorey(BimElement element) {
        Object direct = element.getProperties() != null ? element.getProperties().get("BuildingStorey") : null;
        if (direct != null) {
            return String.valueOf(direct);
        }
        if (element.getPsets() == null) {
            return null;
        }
        Map<String, Object> levelInfo = element.getPsets().get("Pset_SpaceLevelInfo");
        if (levelInfo != null && levelInfo.get("Reference") != null) {
            return String.valueOf(levelInfo.get("Reference"));
        }
        for (Map<String, Object> pset : element.getPsets().values()) {
            for (String key : Arrays.asList("Level", "StoreyName", "BuildingStorey")) {
                if (pset.get(key) != null) {
                    return String.valueOf(pset.get(key));
                }
            }
        }
        return null;
    }

    private static List<BimElement> byStorey(List<BimElement> elements, List<BimElement> reference, boolean buildingContainsAll) {
        return elements.stream()
                .filter(element -> {
                    String storey = containingStorey(element);
                    if (storey == null) {
                        return false;
                    }
                    return reference.stream().anyMatch(ref -> {
                        if (ref.isType(STOREY)) {
                            return storey.equals(ref.getName());
                        }
                        return buildingContainsAll && ref.isType(BUILDING);
                    });
                })
                .collect(Collectors.toList());
    }

    private static List<BimElement> byBox(List<BimElement> elements, List<BimElement> reference,
                                          BiPredicate<BoundingBox, BoundingBox> predicate) {
        return elements.stream()
                .filter(element -> element.getBoundingBox() != null)
                .filter(element -> reference.stream()
                        .filter(ref -> ref.getBoundingBox() != null && !sameElement(ref, element))
                        .anyMatch(ref -> predicate.test(element.getBoundingBox(), ref.getBoundingBox())))
                .collect(Collectors.toList());
    }

    private static boolean sameElement(BimElement a, BimElement b) {
        return a.getId() != null && a.getId().equals(b.getId());
    }
}
