package xyz.vvrf.bimflow.core;

import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.Set;

/**
 * 节点处理器接口：一个节点类型 (kind) 对应一个处理器实现。
 * 处理器声明其期望的输入端口、执行模式和输出形状。
 * 处理器实现应该是线程安全的，它们作为单例注册并在多次运行之间共享。
 * <p>
 * 同步与异步处理器统一返回 {@link Mono}，调度器无需区分二者。
 *
 * @author ruifeng.wen
 */
public interface NodeHandler {

    /**
     * 获取此处理器期望的输入端口。仅用于描述和日志，
     * 解析器会把所有入边按目标端口传入，不做过滤。
     */
    default Set<String> getInputPorts() {
        return Collections.singleton(Ports.INPUT);
    }

    /**
     * 执行模式。{@link ExecutionMode#ASYNC} 的处理器会在配置的节点执行调度器上订阅。
     */
    ExecutionMode getExecutionMode();

    /**
     * 输出形状的简短描述，例如 "elements"、"clashResults"。
     */
    default String getOutputShape() {
        return "any";
    }

    /**
     * 执行节点逻辑。
     *
     * @param invocation 本次调用的节点定义、已解析的输入、进度通道和取消令牌
     * @return 结果 Mono。空 Mono 视为空结果。
     *         抛出异常或返回 Mono.error 会中止整个运行；
     *         返回 {@link SoftError} 值则作为普通数据流向下游。
     */
    Mono<NodeResult> execute(NodeInvocation invocation);
}
