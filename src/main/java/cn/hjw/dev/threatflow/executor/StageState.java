package cn.hjw.dev.threatflow.executor;

/**
 * Stage 状态机: PENDING -> {SKIPPED | RUNNING -> COMPLETED | FAILED}
 */
public enum StageState {
    PENDING,
    SKIPPED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == SKIPPED || this == COMPLETED || this == FAILED;
    }
}
