package xyz.vvrf.bimflow.core;

import reactor.core.publisher.Mono;

/**
 * 同步处理器的基类。子类只需实现 {@link #apply(NodeInvocation)}，
 * 返回值被包装为 {@link NodeResult}，抛出的异常变为错误信号。
 *
 * @author ruifeng.wen
 */
public abstract class SynchronousNodeHandler implements NodeHandler {

    @Override
    public final ExecutionMode getExecutionMode() {
        return ExecutionMode.SYNC;
    }

    @Override
    public final Mono<NodeResult> execute(NodeInvocation invocation) {
        return Mono.fromCallable(() -> NodeResult.of(apply(invocation)));
    }

    /**
     * 计算节点的输出值。
     *
     * @return 输出值，null 表示空结果
     */
    protected abstract Object apply(NodeInvocation invocation);
}
