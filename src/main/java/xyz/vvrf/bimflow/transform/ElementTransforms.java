package xyz.vvrf.bimflow.transform;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.ElementTransform;
import xyz.vvrf.bimflow.model.GeometryFilter;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 本地几何类别提取和元素变换。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class ElementTransforms {

    private static final String OPENING_MARKER = "IFCOPENING";
    private static final Map<String, List<String>> TYPE_MAP = new HashMap<>();

    static {
        TYPE_MAP.put("walls", Arrays.asList("IFCWALL", "IFCWALLSTANDARDCASE"));
        TYPE_MAP.put("slabs", Arrays.asList("IFCSLAB", "IFCROOF"));
        TYPE_MAP.put("columns", Collections.singletonList("IFCCOLUMN"));
        TYPE_MAP.put("beams", Collections.singletonList("IFCBEAM"));
        TYPE_MAP.put("doors", Collections.singletonList("IFCDOOR"));
        TYPE_MAP.put("windows", Collections.singletonList("IFCWINDOW"));
        TYPE_MAP.put("stairs", Arrays.asList("IFCSTAIR", "IFCSTAIRFLIGHT"));
        TYPE_MAP.put("furniture", Collections.singletonList("IFCFURNISHINGELEMENT"));
        TYPE_MAP.put("spaces", Collections.singletonList("IFCSPACE"));
        TYPE_MAP.put("openings", Collections.singletonList("IFCOPENINGELEMENT"));
    }

    private ElementTransforms() {}

    /**
     * 按类别选取元素。类型按大写后的子串匹配，所以 {@code walls} 同时匹配 IfcWall 和 IfcWallStandardCase。
     * 未知类别返回空列表。
     */
    public static List<BimElement> extractGeometry(List<BimElement> elements, GeometryFilter filter) {
        if (elements == null || elements.isEmpty()) {
            return Collections.emptyList();
        }
        String elementType = filter.getElementType() != null ? filter.getElementType() : GeometryFilter.ALL;
        boolean includeOpenings = filter.isIncludeOpenings();

        if (GeometryFilter.ALL.equals(elementType)) {
            return includeOpenings
                    ? elements
                    : elements.stream().filter(e -> !isOpening(e)).collect(Collectors.toList());
        }

        List<String> ifcTypes = TYPE_MAP.get(elementType);
        if (ifcTypes == null) {
            log.warn("Unknown element category '{}'", elementType);
            return Collections.emptyList();
        }
        return elements.stream()
                .filter(e -> includeOpenings || !isOpening(e))
                .filter(e -> {
                    String type = upperType(e);
                    return ifcTypes.stream().anyMatch(type::contains);
                })
                .collect(Collectors.toList());
    }

    /**
     * 返回记录了变换的元素副本。几何本身不在此重新计算。
     */
    public static List<BimElement> transform(List<BimElement> elements, ElementTransform transform) {
        if (elements == null || elements.isEmpty()) {
            return Collections.emptyList();
        }
        return elements.stream()
                .map(element -> {
                    BimElement copy = element.deepCopy();
                    copy.setTransform(transform);
                    return copy;
                })
                .collect(Collectors.toList());
    }

    private static boolean isOpening(BimElement element) {
        return upperType(element).contains(OPENING_MARKER);
    }

    private static String upperType(BimElement element) {
        return element.getType() != null ? element.getType().toUpperCase(Locale.ROOT) : "";
    }
}
