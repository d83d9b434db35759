package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.collaborator.QuantityWorker;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.NodeStatusPatch;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.QuantityResult;
import xyz.vvrf.bimflow.transform.Elements;
import xyz.vvrf.bimflow.transform.QuantityCalculator;

import java.util.List;
import java.util.UUID;

/**
 * 数量节点。有 {@link QuantityWorker} 时把计算交给它，并通过进度通道报告请求的 messageId；
 * 否则在本地汇总。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class QuantityNodeHandler implements NodeHandler {

    private final QuantityWorker quantityWorker;

    public QuantityNodeHandler(QuantityWorker quantityWorker) {
        this.quantityWorker = quantityWorker;
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return quantityWorker != null ? ExecutionMode.ASYNC : ExecutionMode.SYNC;
    }

    @Override
    public String getOutputShape() {
        return "quantityResults";
    }

    @Override
    public Mono<NodeResult> execute(NodeInvocation invocation) {
        NodeDefinition node = invocation.getNode();
        String quantityType = node.getString("quantityType", "area");
        String groupBy = node.getString("groupBy", QuantityCalculator.GROUP_NONE);
        String unit = node.getString("unit", "");

        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            log.warn("No input provided to quantity node '{}'", node.getId());
            return Mono.just(NodeResult.of(QuantityResult.zero(quantityType, QuantityCalculator.defaultUnit(quantityType))));
        }
        List<BimElement> elements = Elements.asElements(input);

        if (quantityWorker == null) {
            return Mono.fromCallable(() -> NodeResult.of(QuantityCalculator.calculate(elements, quantityType, groupBy, unit)));
        }

        String messageId = node.getId() + "-" + UUID.randomUUID().toString().substring(0, 8);
        invocation.report(NodeStatusPatch.progress(0, "Extracting quantities...").toBuilder()
                .correlationId(messageId)
                .build());
        log.debug("Node '{}' sent quantity request '{}' for {} elements", node.getId(), messageId, elements.size());
        return quantityWorker.extract(elements, quantityType, groupBy, messageId)
                .map(result -> {
                    invocation.report(NodeStatusPatch.finished());
                    return NodeResult.of(result);
                })
                .doOnError(e -> invocation.report(NodeStatusPatch.failed(e.getMessage())));
    }
}
