package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.collaborator.GeometryCapability;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.TaggedValue;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.ClashDetection;
import xyz.vvrf.bimflow.model.ClashReport;
import xyz.vvrf.bimflow.transform.ElementAnalysis;
import xyz.vvrf.bimflow.transform.Elements;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 分析节点：clash / adjacency / spatial。
 * <p>
 * 碰撞检测通过 {@link GeometryCapability} 完成，结果为 {@code TaggedValue("clashResults", ClashReport)}。
 * 输入缺失、没有几何能力或几何尚未就绪等可预期的情况返回 {@link xyz.vvrf.bimflow.core.SoftError}，不中止运行。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class AnalysisNodeHandler implements NodeHandler {

    private static final double DEFAULT_TOLERANCE_MM = 10;

    private final GeometryCapability geometryCapability;

    public AnalysisNodeHandler(GeometryCapability geometryCapability) {
        this.geometryCapability = geometryCapability;
    }

    @Override
    public Set<String> getInputPorts() {
        return new HashSet<>(Arrays.asList(Ports.INPUT, Ports.REFERENCE));
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return ExecutionMode.ASYNC;
    }

    @Override
    public String getOutputShape() {
        return TaggedValue.CLASH_RESULTS;
    }

    @Override
    public Mono<NodeResult> execute(NodeInvocation invocation) {
        return Mono.fromCallable(() -> analyze(invocation));
    }

    private NodeResult analyze(NodeInvocation invocation) {
        NodeDefinition node = invocation.getNode();
        List<BimElement> elements = Elements.asElements(invocation.getInputs().getRaw(Ports.INPUT));
        if (elements.isEmpty()) {
            log.warn("No elements for analysis node '{}'", node.getId());
            return NodeResult.softError("No elements to analyze");
        }
        double tolerance = node.getDouble("tolerance", DEFAULT_TOLERANCE_MM);
        String analysisType = node.getString("analysisType", "clash");

        switch (analysisType) {
            case "clash":
                return detectClashes(node, elements,
                        Elements.asElements(invocation.getInputs().getRaw(Ports.REFERENCE)), tolerance);
            case "adjacency":
                return NodeResult.of(ElementAnalysis.adjacency(elements, tolerance / 1000.0));
            case "spatial":
            case "space":
                Map<String, Object> metrics = ElementAnalysis.spatialMetrics(elements, node.getString("metric", "area"));
                return metrics != null ? NodeResult.of(metrics) : NodeResult.softError("Unknown spatial metric");
            default:
                log.warn("Unknown analysis type '{}' on node '{}'", analysisType, node.getId());
                return NodeResult.softError("Unknown analysis type");
        }
    }

    private NodeResult detectClashes(NodeDefinition node, List<BimElement> elements,
                                     List<BimElement> reference, double tolerance) {
        if (reference.isEmpty()) {
            return NodeResult.softError("No reference elements for clash detection");
        }
        if (geometryCapability == null) {
            return NodeResult.softError("Active 3D Viewer not found for clash detection");
        }
        if (!geometryCapability.isReady()) {
            log.info("Clash check skipped on node '{}': geometry is not ready", node.getId());
            return NodeResult.softError("Viewer is initializing or loading geometry.");
        }

        List<Integer> idsA = expressIds(elements);
        List<Integer> idsB = expressIds(reference);
        if (idsA.isEmpty() || idsB.isEmpty()) {
            return NodeResult.softError("Could not extract valid element IDs for clash detection");
        }

        ClashDetection detection;
        try {
            detection = geometryCapability.detectClashes(idsA, idsB, tolerance);
        } catch (RuntimeException e) {
            log.warn("Geometric clash detection failed on node '{}': {}", node.getId(), e.getMessage(), e);
            return NodeResult.softError("Failed to perform geometric clash detection");
        }

        List<ClashReport.Detail> details = detection.getDetails().stream()
                .map(pair -> new ClashReport.Detail(pair.getId(),
                        summarize(pair.getElement1Id(), elements, reference),
                        summarize(pair.getElement2Id(), reference, elements),
                        pair.getDistance()))
                .collect(Collectors.toList());
        log.debug("Node '{}' found {} clashes ({} vs {} elements)", node.getId(), detection.getClashes(), idsA.size(), idsB.size());
        return NodeResult.tagged(TaggedValue.CLASH_RESULTS, new ClashReport(detection.getClashes(), details, true));
    }

    private static List<Integer> expressIds(List<BimElement> elements) {
        return elements.stream()
                .map(BimElement::getExpressId)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private static ClashReport.ElementSummary summarize(Integer expressId, List<BimElement> primary, List<BimElement> fallback) {
        BimElement element = find(expressId, primary);
        if (element == null) {
            element = find(expressId, fallback);
        }
        if (element == null) {
            return new ClashReport.ElementSummary(expressId, null, null);
        }
        String name = element.getName() != null ? element.getName() : "ID " + expressId;
        return new ClashReport.ElementSummary(expressId, element.getType(), name);
    }

    private static BimElement find(Integer expressId, List<BimElement> elements) {
        for (BimElement element : elements) {
            if (Objects.equals(element.getExpressId(), expressId)) {
                return element;
            }
        }
        return null;
    }
}
