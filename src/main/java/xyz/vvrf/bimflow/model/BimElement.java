package xyz.vvrf.bimflow.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模型中的单个构件。
 * <p>
 * {@code type} 为 IFC 实体类型 (如 {@code IFCWALL})；{@code properties} 为直接属性，
 * {@code psets} / {@code qtos} 为属性集和数量集 (名称 -> 属性 -> 值)；
 * {@code relations} 为关系类型到相关元素 ID 的映射。
 * 处理器从不修改输入元素，而是在 {@link #deepCopy()} 的副本上修改。
 */
@Data
@Builder(toBuilder = true)
public class BimElement {

    public static final String NAME = "Name";

    private String id;
    private Integer expressId;
    private String type;
    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Map<String, Object>> psets = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Map<String, Object>> qtos = new LinkedHashMap<>();
    @Builder.Default
    private List<Classification> classifications = new ArrayList<>();
    private PropertyInfo propertyInfo;
    private ElementTransform transform;
    private BoundingBox boundingBox;
    @Builder.Default
    private Map<String, List<String>> relations = new LinkedHashMap<>();

    public String getName() {
        Object name = properties != null ? properties.get(NAME) : null;
        return name != null ? String.valueOf(name) : null;
    }

    public boolean isType(String ifcType) {
        return type != null && type.equalsIgnoreCase(ifcType);
    }

    /**
     * 复制元素及其所有嵌套的属性容器。属性值本身不复制。
     */
    public BimElement deepCopy() {
        Map<String, List<String>> relationsCopy = new LinkedHashMap<>();
        if (relations != null) {
            relations.forEach((k, v) -> relationsCopy.put(k, new ArrayList<>(v)));
        }
        return toBuilder()
                .properties(properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>())
                .psets(copyNested(psets))
                .qtos(copyNested(qtos))
                .classifications(classifications != null ? new ArrayList<>(classifications) : new ArrayList<>())
                .relations(relationsCopy)
                .build();
    }

    private static Map<String, Map<String, Object>> copyNested(Map<String, Map<String, Object>> source) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, v != null ? new LinkedHashMap<>(v) : new LinkedHashMap<>()));
        }
        return copy;
    }
}
