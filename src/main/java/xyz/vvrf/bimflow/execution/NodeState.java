package xyz.vvrf.bimflow.execution;

/**
 * 单个节点在一次运行中的状态：{@code PENDING -> RESOLVING_INPUTS -> DISPATCHING -> CACHED}。
 * 已缓存的节点不会被再次进入。
 */
public enum NodeState {
    PENDING,
    RESOLVING_INPUTS,
    DISPATCHING,
    CACHED,
    /** 取消后未被调度 */
    SKIPPED
}
