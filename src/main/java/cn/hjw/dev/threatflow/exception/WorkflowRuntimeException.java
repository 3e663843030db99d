package cn.hjw.dev.threatflow.exception;

// 所有工作流运行期异常的基类, 统一使用非受检异常向上传播
public class WorkflowRuntimeException extends RuntimeException {

    public WorkflowRuntimeException(String message) {
        super(message);
    }

    public WorkflowRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

}
