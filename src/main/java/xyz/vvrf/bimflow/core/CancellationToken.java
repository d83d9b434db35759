package xyz.vvrf.bimflow.core;

/**
 * 协作式取消令牌。{@code stop()} 之后，尚未开始的节点不会再被调度；
 * 已在执行中的处理器不会被中断，需要及早退出的处理器应自行轮询此令牌。
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
