package xyz.vvrf.bimflow.core;

/**
 * 节点处理器的执行模式。
 */
public enum ExecutionMode {
    /** 纯数据变换，立即返回结果，不得阻塞 */
    SYNC,
    /** 返回挂起的结果，如加载模型文件、几何提取、工作线程往返 */
    ASYNC
}
