package xyz.vvrf.bimflow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInputs;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.WorkflowGraph;

import java.util.Map;

/**
 * 节点调度器接口。
 * 根据节点类型选择处理器，传入已解析的输入、配置和进度通道，
 * 把同步和异步处理器的结果统一为一个 Mono。
 *
 * @author ruifeng.wen
 */
public interface NodeDispatcher {

    /**
     * 在运行开始时为图中出现的每个节点类型解析处理器。
     * 没有注册处理器的类型不在返回的映射中。
     */
    Map<String, NodeHandler> bindHandlers(WorkflowGraph graph);

    /**
     * 执行单个节点。
     *
     * @param node    节点定义
     * @param inputs  已解析的输入
     * @param context 运行上下文，提供处理器绑定、进度通道和取消令牌
     * @return 节点结果。未知类型返回空结果；处理器失败时发出
     *         {@link xyz.vvrf.bimflow.exception.NodeExecutionException}
     */
    Mono<NodeResult> dispatch(NodeDefinition node, NodeInputs inputs, WorkflowExecutionContext context);
}
