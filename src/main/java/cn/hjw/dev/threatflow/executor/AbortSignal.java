package cn.hjw.dev.threatflow.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 中止信号, 执行器只在 Stage 之间检查, 不会打断正在进行的外部调用
 */
public class AbortSignal {

    private final AtomicBoolean aborted = new AtomicBoolean(false);

    public static AbortSignal none() {
        return new AbortSignal();
    }

    public void abort() {
        aborted.set(true);
    }

    public boolean isAborted() {
        return aborted.get();
    }
}
