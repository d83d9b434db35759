package xyz.vvrf.bimflow.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.collaborator.GeometryCapability;
import xyz.vvrf.bimflow.collaborator.ModelLoader;
import xyz.vvrf.bimflow.collaborator.QuantityWorker;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.registry.NodeHandlerRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内置节点处理器集合。协作者均可为 null，缺失时相应节点退回本地实现或返回软错误。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Builder
public class BuiltinNodeHandlers {

    private final ModelLoader modelLoader;
    private final GeometryCapability geometryCapability;
    private final QuantityWorker quantityWorker;
    private final ObjectMapper objectMapper;

    /**
     * @return 节点类型 -> 处理器，按编辑器面板中的顺序
     */
    public Map<String, NodeHandler> handlers() {
        Map<String, NodeHandler> handlers = new LinkedHashMap<>();
        handlers.put(NodeKinds.IFC, new IfcNodeHandler(modelLoader));
        handlers.put(NodeKinds.GEOMETRY, new GeometryNodeHandler(geometryCapability));
        handlers.put(NodeKinds.FILTER, new FilterNodeHandler());
        handlers.put(NodeKinds.TRANSFORM, new TransformNodeHandler());
        handlers.put(NodeKinds.QUANTITY, new QuantityNodeHandler(quantityWorker));
        handlers.put(NodeKinds.PROPERTY, new PropertyNodeHandler());
        handlers.put(NodeKinds.CLASSIFICATION, new ClassificationNodeHandler());
        handlers.put(NodeKinds.SPATIAL, new SpatialNodeHandler());
        handlers.put(NodeKinds.RELATIONSHIP, new RelationshipNodeHandler());
        handlers.put(NodeKinds.ANALYSIS, new AnalysisNodeHandler(geometryCapability));
        handlers.put(NodeKinds.EXPORT, new ExportNodeHandler(objectMapper != null ? objectMapper : new ObjectMapper()));
        handlers.put(NodeKinds.PARAMETER, new ParameterNodeHandler());
        handlers.put(NodeKinds.VIEWER, new ViewerNodeHandler());
        handlers.put(NodeKinds.WATCH, new WatchNodeHandler());
        return handlers;
    }

    /**
     * 注册所有内置处理器。已注册的类型 (例如用户提供的同名处理器) 保持不变。
     */
    public void registerAll(NodeHandlerRegistry registry) {
        int registered = 0;
        for (Map.Entry<String, NodeHandler> entry : handlers().entrySet()) {
            if (registry.isRegistered(entry.getKey())) {
                log.info("节点类型 '{}' 已有自定义处理器，跳过内置处理器。", entry.getKey());
                continue;
            }
            registry.register(entry.getKey(), entry.getValue());
            registered++;
        }
        log.info("已注册 {} 个内置节点处理器。", registered);
    }
}
