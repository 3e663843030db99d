package cn.hjw.dev.threatflow.client;

import cn.hjw.dev.threatflow.config.PollingGovernance;
import cn.hjw.dev.threatflow.exception.AnalysisClientException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 重试装饰器: 只重试 AnalysisClientException, 请求级错误 (如空任务列表) 直接抛出
 */
@Slf4j
public class ResilientAnalysisClient implements AnalysisClient {

    private final AnalysisClient delegate;
    private final PollingGovernance governance;

    public ResilientAnalysisClient(AnalysisClient delegate, PollingGovernance governance) {
        this.delegate = delegate;
        this.governance = governance != null ? governance : PollingGovernance.defaults();
    }

    @Override
    public String submit(List<String> taskNames, byte[] artifact) {
        return withRetry("submit " + taskNames, () -> delegate.submit(taskNames, artifact));
    }

    @Override
    public JobStatus poll(String jobId) {
        return withRetry("poll job " + jobId, () -> delegate.poll(jobId));
    }

    private <V> V withRetry(String operation, Supplier<V> call) {
        int attempts = 1 + Math.max(0, governance.getMaxRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (AnalysisClientException e) {
                if (attempt >= attempts) {
                    log.error("Analysis call [{}] gave up after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.warn("Analysis call [{}] failed ({}), attempt {} of {}", operation, e.getMessage(), attempt, attempts);
                pause(operation, governance.getRetryBackoff());
            }
        }
    }

    private static void pause(String operation, Duration backoff) {
        if (backoff == null || backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisClientException("Interrupted while waiting to retry " + operation, e);
        }
    }
}
