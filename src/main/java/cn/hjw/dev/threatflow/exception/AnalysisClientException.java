package cn.hjw.dev.threatflow.exception;

// 分析服务调用失败 (传输层或服务端错误), 可以按治理配置重试
public class AnalysisClientException extends WorkflowRuntimeException {

    public AnalysisClientException(String message) {
        super(message);
    }

    public AnalysisClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
