package xyz.vvrf.bimflow.test.util;

import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeResult;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 用于测试目的的可配置 NodeHandler 实现。
 * 记录调用次数和每次调用的参数，使用 Builder 模式进行配置。
 */
public class TestNodeHandler implements NodeHandler {

    private final ExecutionMode executionMode;
    private final Function<NodeInvocation, Mono<NodeResult>> executionLogic;
    private final AtomicInteger invocationCount = new AtomicInteger();
    private final List<NodeInvocation> invocations = new CopyOnWriteArrayList<>();

    private TestNodeHandler(Builder builder) {
        this.executionMode = Objects.requireNonNull(builder.executionMode, "执行模式不能为空");
        this.executionLogic = builder.executionLogic;
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    @Override
    public Mono<NodeResult> execute(NodeInvocation invocation) {
        invocationCount.incrementAndGet();
        invocations.add(invocation);
        if (executionLogic == null) {
            // 默认行为：返回节点 ID 作为值
            return Mono.just(NodeResult.of(invocation.getNodeId()));
        }
        return executionLogic.apply(invocation);
    }

    public int getInvocationCount() {
        return invocationCount.get();
    }

    public List<NodeInvocation> getInvocations() {
        return invocations;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 返回固定值的同步处理器。
     */
    public static TestNodeHandler returning(Object value) {
        return builder().logic(inv -> Mono.just(NodeResult.of(value))).build();
    }

    /**
     * 直接抛出异常的处理器。
     */
    public static TestNodeHandler throwing(RuntimeException error) {
        return builder().logic(inv -> {
            throw error;
        }).build();
    }

    public static class Builder {
        private ExecutionMode executionMode = ExecutionMode.SYNC;
        private Function<NodeInvocation, Mono<NodeResult>> executionLogic;

        public Builder mode(ExecutionMode executionMode) {
            this.executionMode = executionMode;
            return this;
        }

        public Builder logic(Function<NodeInvocation, Mono<NodeResult>> executionLogic) {
            this.executionLogic = executionLogic;
            return this;
        }

        public TestNodeHandler build() {
            return new TestNodeHandler(this);
        }
    }
}
