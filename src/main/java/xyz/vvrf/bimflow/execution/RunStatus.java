package xyz.vvrf.bimflow.execution;

/**
 * 一次运行的最终状态。
 */
public enum RunStatus {
    /** 全部节点执行完毕 */
    COMPLETED,
    /** 调用了 stop()，之后未开始的节点没有被调度 */
    CANCELLED,
    /** 致命错误中止了运行，不暴露任何结果 */
    ABORTED
}
