package xyz.vvrf.bimflow.handler;

/**
 * 内置节点类型名称，与编辑器保存的 kind 字段一致。
 */
public final class NodeKinds {

    public static final String IFC = "ifcNode";
    public static final String GEOMETRY = "geometryNode";
    public static final String FILTER = "filterNode";
    public static final String TRANSFORM = "transformNode";
    public static final String QUANTITY = "quantityNode";
    public static final String PROPERTY = "propertyNode";
    public static final String CLASSIFICATION = "classificationNode";
    public static final String SPATIAL = "spatialNode";
    public static final String RELATIONSHIP = "relationshipNode";
    public static final String ANALYSIS = "analysisNode";
    public static final String EXPORT = "exportNode";
    public static final String PARAMETER = "parameterNode";
    public static final String VIEWER = "viewerNode";
    public static final String WATCH = "watchNode";

    private NodeKinds() {}
}
