package xyz.vvrf.bimflow.transform;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 按关系类型和方向查询元素。
 * <p>
 * outgoing 返回自身声明了该类型关系的元素；incoming 返回被输入中其他元素以该类型关系引用的元素。
 * 未知的关系类型按 containment 处理。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class RelationshipQueries {

    public static final String CONTAINMENT = "containment";
    public static final String INCOMING = "incoming";

    private static final List<String> RELATION_TYPES = Arrays.asList(
            CONTAINMENT, "aggregation", "voiding", "material", "space-boundary", "connectivity");

    private RelationshipQueries() {}

    public static String normalizeRelationType(String relationType) {
        return RELATION_TYPES.contains(relationType) ? relationType : CONTAINMENT;
    }

    public static List<BimElement> query(List<BimElement> elements, String relationType, String direction) {
        if (elements == null || elements.isEmpty()) {
            log.debug("No elements for relationship query");
            return Collections.emptyList();
        }
        String type = normalizeRelationType(relationType);
        if (INCOMING.equals(direction)) {
            Set<String> referenced = new HashSet<>();
            for (BimElement element : elements) {
                referenced.addAll(related(element, type));
            }
            return elements.stream()
                    .filter(element -> element.getId() != null && referenced.contains(element.getId()))
                    .collect(Collectors.toList());
        }
        return elements.stream()
                .filter(element -> !related(element, type).isEmpty())
                .collect(Collectors.toList());
    }

    private static List<String> related(BimElement element, String type) {
        if (element.getRelations() == null) {
            return Collections.emptyList();
        }
        List<String> ids = element.getRelations().get(type);
        return ids != null ? ids : Collections.emptyList();
    }
}
