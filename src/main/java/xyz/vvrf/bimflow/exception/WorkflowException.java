package xyz.vvrf.bimflow.exception;

/**
 * 工作流引擎所有致命错误的基类。
 *
 * @author ruifeng.wen
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
