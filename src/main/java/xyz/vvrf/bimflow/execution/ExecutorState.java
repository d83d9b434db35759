package xyz.vvrf.bimflow.execution;

/**
 * 执行器状态机：{@code IDLE -> RUNNING -> (COMPLETED | ABORTED)}。
 * stop() 把运行中的执行器置为 {@code CANCELLED}，就调度而言等同于 {@code IDLE}：
 * 三种结局状态只记录上一次运行如何结束，不阻止新的运行。
 */
public enum ExecutorState {
    IDLE,
    RUNNING,
    COMPLETED,
    CANCELLED,
    ABORTED;

    public boolean isRunning() {
        return this == RUNNING;
    }

    /**
     * 除 {@code RUNNING} 外的状态都只描述上一次运行，执行器可以接受新运行。
     */
    public boolean acceptsNewRun() {
        return this != RUNNING;
    }
}
