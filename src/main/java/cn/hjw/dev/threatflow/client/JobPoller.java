package cn.hjw.dev.threatflow.client;

import cn.hjw.dev.threatflow.config.PollingGovernance;
import cn.hjw.dev.threatflow.exception.AnalysisClientException;
import cn.hjw.dev.threatflow.exception.NoTasksException;
import cn.hjw.dev.threatflow.exception.StageExecutionException;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批次执行: 一次提交, 轮询直到作业结束
 * <p>
 * 对调用方来说这是一个阻塞单元, 也是每个 Stage 唯一的挂起点。
 */
@Slf4j
@RequiredArgsConstructor
public class JobPoller {

    private final AnalysisClient client;
    private final PollingGovernance governance;

    /**
     * @return 每个任务恰好一份报告 (服务未返回的任务补一份 FAILURE 报告)
     * @throws StageExecutionException 整个批次失败或超时, 包括分析服务抛出的任意运行时异常
     */
    public List<ExecutionReport> runBatch(int stageId, List<String> taskNames, byte[] artifact) {
        String jobId;
        try {
            jobId = client.submit(taskNames, artifact);
        } catch (NoTasksException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageExecutionException(stageId, "Submission failed: " + describe(e), e);
        }
        log.info("Stage [{}] submitted job {} with tasks {}", stageId, jobId, taskNames);

        JobStatus status = awaitCompletion(stageId, jobId);
        if (status.getState() == JobState.FAILED) {
            throw new StageExecutionException(stageId, "Job " + jobId + " failed: " + status.getMessage());
        }
        return normalize(taskNames, status.getReports());
    }

    private JobStatus awaitCompletion(int stageId, String jobId) {
        Duration interval = governance.getPollInterval();
        long deadline = System.nanoTime() + governance.getAnalysisTimeout().toNanos();

        while (true) {
            JobStatus status;
            try {
                status = client.poll(jobId);
            } catch (RuntimeException e) {
                throw new StageExecutionException(stageId, "Polling job " + jobId + " failed: " + describe(e), e);
            }
            if (status == null) {
                throw new StageExecutionException(stageId, "Polling job " + jobId + " returned no status");
            }
            if (!status.isRunning()) {
                log.info("Stage [{}] job {} finished with state {}", stageId, jobId, status.getState());
                return status;
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new StageExecutionException(stageId, "Job " + jobId + " did not complete within "
                        + governance.getAnalysisTimeout().toSeconds() + "s");
            }
            if (!interval.isZero()) {
                try {
                    Thread.sleep(interval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StageExecutionException(stageId, "Interrupted while polling job " + jobId, e);
                }
            }
        }
    }

    // 非 AnalysisClientException 的异常也按批次失败处理, 消息里带上异常类型
    private static String describe(RuntimeException e) {
        return e instanceof AnalysisClientException ? e.getMessage() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    // 只保留本批次请求的任务, 同名报告取第一份
    private List<ExecutionReport> normalize(List<String> taskNames, List<ExecutionReport> reports) {
        Map<String, ExecutionReport> byTask = new LinkedHashMap<>();
        for (ExecutionReport report : reports) {
            if (taskNames.contains(report.getTaskName())) {
                byTask.putIfAbsent(report.getTaskName(), report);
            } else {
                log.warn("Ignoring report for unrequested task [{}]", report.getTaskName());
            }
        }
        List<ExecutionReport> result = new ArrayList<>();
        for (String taskName : taskNames) {
            ExecutionReport report = byTask.get(taskName);
            result.add(report != null ? report : ExecutionReport.failure(taskName, "no report returned"));
        }
        return result;
    }
}
