package cn.hjw.dev.threatflow.exception;

import lombok.Getter;

/**
 * 分析服务对整个批次的失败, 只会把对应 Stage 标记为 FAILED, 不会中止整个运行
 */
@Getter
public class StageExecutionException extends WorkflowRuntimeException {

    private final int stageId;

    public StageExecutionException(int stageId, String message) {
        super(message);
        this.stageId = stageId;
    }

    public StageExecutionException(int stageId, String message, Throwable cause) {
        super(message, cause);
        this.stageId = stageId;
    }
}
