package xyz.vvrf.bimflow.exception;

/**
 * 在执行器已有运行进行中时再次调用 execute()。正在进行的运行不受影响。
 */
public class AlreadyRunningException extends WorkflowException {

    public AlreadyRunningException(String workflowName, String activeRunId) {
        super(String.format("Workflow '%s' is already running (RunId: %s).", workflowName, activeRunId));
    }
}
