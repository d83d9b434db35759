package xyz.vvrf.bimflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;
import xyz.vvrf.bimflow.core.EdgeDefinition;
import xyz.vvrf.bimflow.core.NodeInputs;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.exception.UnknownNodeReferenceException;

import java.util.List;
import java.util.function.Function;

/**
 * 为节点收集直接前驱的输出，并按边的目标端口放入输入映射。
 * <p>
 * 拉取语义：前驱结果来自本次运行的记忆化缓存，尚未计算时通过 {@code upstream} 触发其执行。
 * 按图中边的顺序依次处理；多条边指向同一端口时，后处理的边覆盖先前的值。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class InputResolver {

    /**
     * 解析节点输入。
     *
     * @param nodeId   目标节点 ID
     * @param context  运行上下文
     * @param upstream 获取（必要时触发）前驱节点结果的函数
     * @return 已解析的输入；如果边引用了不存在的节点，则发出 {@link UnknownNodeReferenceException}
     */
    public Mono<NodeInputs> resolve(String nodeId, WorkflowExecutionContext context,
                                    Function<String, Mono<NodeResult>> upstream) {
        List<EdgeDefinition> incomingEdges = context.getGraph().getIncomingEdges(nodeId);
        if (incomingEdges.isEmpty()) {
            log.trace("[RunId: {}][Workflow: '{}'] Node '{}' has no incoming edges.",
                    context.getRunId(), context.getWorkflowName(), nodeId);
            return Mono.just(NodeInputs.none());
        }

        return Flux.fromIterable(incomingEdges)
                .concatMap(edge -> {
                    if (!context.getGraph().containsNode(edge.getSourceNodeId())) {
                        return Mono.error(new UnknownNodeReferenceException(
                                context.getWorkflowName(), edge.getSourceNodeId(), edge.toString()));
                    }
                    return upstream.apply(edge.getSourceNodeId()).map(result -> Tuples.of(edge, result));
                })
                .collectList()
                .map(resolved -> {
                    NodeInputs.Builder builder = NodeInputs.builder();
                    resolved.forEach(tuple -> {
                        EdgeDefinition edge = tuple.getT1();
                        boolean overwritten = builder.put(edge.getTargetPort(), tuple.getT2().getRawValue());
                        if (overwritten) {
                            log.debug("[RunId: {}][Workflow: '{}'] Node '{}': port '{}' written by multiple edges, '{}' wins.",
                                    context.getRunId(), context.getWorkflowName(), nodeId, edge.getTargetPort(), edge.getSourceNodeId());
                        }
                        log.trace("[RunId: {}][Workflow: '{}'] Wired {} into node '{}'.",
                                context.getRunId(), context.getWorkflowName(), edge, nodeId);
                    });
                    return builder.build();
                });
    }
}
