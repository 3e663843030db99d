package cn.hjw.dev.threatflow.exception;

// 提交了空的任务列表, 属于请求级错误, 永远不重试
public class NoTasksException extends WorkflowRuntimeException {

    public NoTasksException() {
        super("Cannot submit an analysis job without tasks");
    }
}
