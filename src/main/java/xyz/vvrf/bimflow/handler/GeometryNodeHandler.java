package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.collaborator.GeometryCapability;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.NodeStatusPatch;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.model.BimModel;
import xyz.vvrf.bimflow.model.GeometryFilter;
import xyz.vvrf.bimflow.transform.Elements;
import xyz.vvrf.bimflow.transform.ElementTransforms;

/**
 * 几何节点。{@code useActualGeometry} 为 true 且有几何能力时调用 {@link GeometryCapability}，
 * 否则按 {@code elementType} 在本地筛选模型元素。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class GeometryNodeHandler implements NodeHandler {

    private final GeometryCapability geometryCapability;

    public GeometryNodeHandler(GeometryCapability geometryCapability) {
        this.geometryCapability = geometryCapability;
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return geometryCapability != null ? ExecutionMode.ASYNC : ExecutionMode.SYNC;
    }

    @Override
    public String getOutputShape() {
        return "elements";
    }

    @Override
    public Mono<NodeResult> execute(NodeInvocation invocation) {
        NodeDefinition node = invocation.getNode();
        GeometryFilter filter = new GeometryFilter(
                node.getString("elementType", GeometryFilter.ALL),
                node.getBoolean("includeOpenings", true));

        if (node.getBoolean("useActualGeometry", false)) {
            if (geometryCapability != null) {
                return extractActual(invocation, filter);
            }
            log.warn("Node '{}' requested actual geometry but no geometry capability is configured, using local extraction",
                    node.getId());
        }
        return Mono.fromCallable(() -> NodeResult.of(
                ElementTransforms.extractGeometry(Elements.asElements(invocation.getInputs().getRaw(Ports.INPUT)), filter)));
    }

    private Mono<NodeResult> extractActual(NodeInvocation invocation, GeometryFilter filter) {
        String nodeId = invocation.getNodeId();
        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            return Mono.error(new IllegalArgumentException("No input provided to geometry node " + nodeId));
        }
        if (!(input instanceof BimModel)) {
            return Mono.error(new IllegalArgumentException(
                    "Input to geometry node " + nodeId + " is not a valid IFC model"));
        }

        invocation.reportProgress(5, "Starting geometry extraction...");
        return geometryCapability.extractGeometry((BimModel) input, filter, invocation.progressCallback())
                .map(elements -> {
                    invocation.report(NodeStatusPatch.finished());
                    log.debug("Node '{}' extracted geometry for {} elements", nodeId, elements.size());
                    return NodeResult.of(elements);
                })
                .doOnError(e -> {
                    log.error("Error during geometry extraction for node '{}': {}", nodeId, e.getMessage());
                    invocation.report(NodeStatusPatch.failed(e.getMessage()));
                });
    }
}
