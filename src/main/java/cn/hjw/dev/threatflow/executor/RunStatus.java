package cn.hjw.dev.threatflow.executor;

/**
 * 整体运行状态, 按严重程度递增
 */
public enum RunStatus {
    COMPLETED,
    FAILED,
    ABORTED;

    public RunStatus worst(RunStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
