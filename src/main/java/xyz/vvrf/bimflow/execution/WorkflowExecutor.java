package xyz.vvrf.bimflow.execution;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.bimflow.sink.NodeProgressEvent;

/**
 * 绑定到一个工作流图的执行器。
 * 同一时刻最多只有一个活动运行。
 *
 * @author ruifeng.wen
 */
public interface WorkflowExecutor {

    /**
     * 执行整个图。订阅时才开始运行。
     * <p>
     * 已有运行在进行时发出 {@link xyz.vvrf.bimflow.exception.AlreadyRunningException}；
     * 图中有环时发出 {@link xyz.vvrf.bimflow.exception.CyclicGraphException}，不调用任何处理器；
     * 处理器失败时发出 {@link xyz.vvrf.bimflow.exception.NodeExecutionException}，整个运行中止。
     *
     * @return 按拓扑顺序排列的节点结果
     */
    Mono<WorkflowRunResult> execute();

    /**
     * 请求停止当前运行。已在执行中的处理器不会被中断，之后的节点不再调度。
     * 执行器立即回到可接受新运行的状态。
     *
     * @return 如果有活动运行被停止，则返回 true
     */
    boolean stop();

    /**
     * 执行器当前状态。{@code COMPLETED}、{@code CANCELLED}、{@code ABORTED} 描述的是最近一次运行的结局，
     * 除 {@code RUNNING} 以外的任何状态下都可以调用 {@link #execute()}，见 {@link ExecutorState#acceptsNewRun()}。
     * 被 stop() 的运行可能仍有处理器在收尾，此时状态已是 {@code CANCELLED}。
     */
    ExecutorState getState();

    /**
     * 执行器所有运行的进度事件热流。没有订阅者时事件被丢弃。
     */
    Flux<NodeProgressEvent> progressEvents();
}
