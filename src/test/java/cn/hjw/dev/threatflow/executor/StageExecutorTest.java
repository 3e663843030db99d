package cn.hjw.dev.threatflow.executor;

import cn.hjw.dev.threatflow.client.AnalysisClient;
import cn.hjw.dev.threatflow.client.JobPoller;
import cn.hjw.dev.threatflow.client.JobStatus;
import cn.hjw.dev.threatflow.compile.ExecutionPlan;
import cn.hjw.dev.threatflow.compile.Stage;
import cn.hjw.dev.threatflow.condition.ConditionEvaluator;
import cn.hjw.dev.threatflow.config.PollingGovernance;
import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import cn.hjw.dev.threatflow.model.ConditionKind;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import cn.hjw.dev.threatflow.support.ScriptedAnalysisClient;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
public class StageExecutorTest {

    private static final byte[] ARTIFACT = "sample".getBytes();

    private static final PollingGovernance FAST = PollingGovernance.builder()
            .pollInterval(Duration.ZERO)
            .analysisTimeout(Duration.ofSeconds(5))
            .build();

    private static StageExecutor executorFor(AnalysisClient client) {
        return new StageExecutor(new JobPoller(client, FAST), new ConditionEvaluator());
    }

    private static ConditionDescriptor malicious(String task) {
        return ConditionDescriptor.builder().kind(ConditionKind.VERDICT_MALICIOUS).sourceTask(task).build();
    }

    @Test
    public void testRoutingOnlyStageNeverSubmits() {
        AnalysisClient client = mock(AnalysisClient.class);
        ExecutionPlan plan = new ExecutionPlan("src", List.of(
                new Stage(0, List.of(), null, List.of("out"), List.of(), "routing only")));

        ExecutionOutcome outcome = executorFor(client).execute(plan, ARTIFACT);

        verify(client, never()).submit(anyList(), any());
        Assertions.assertEquals(StageState.COMPLETED, outcome.getStageStates().get(0));
        Assertions.assertTrue(outcome.getRoutingRecords().get(0).isExecuted());
        Assertions.assertEquals(RunStatus.COMPLETED, outcome.getOverallStatus());
    }

    @Test
    public void testBranchTakenAndSkipped() {
        AnalysisClient client = mock(AnalysisClient.class);
        when(client.submit(eq(List.of("ClamAV")), any())).thenReturn("job-1");
        when(client.poll("job-1")).thenReturn(JobStatus.completed(List.of(ExecutionReport.success("ClamAV",
                JsonNodeFactory.instance.objectNode().put("malicious", true)))));

        ConditionDescriptor condition = malicious("ClamAV");
        ExecutionPlan plan = new ExecutionPlan("src", List.of(
                new Stage(0, List.of("ClamAV"), null, List.of(), List.of(), "stage 0"),
                new Stage(1, List.of(), condition, List.of("alert"), List.of(0), "true"),
                new Stage(2, List.of(), condition.negated(), List.of("archive"), List.of(0), "false")));

        ExecutionOutcome outcome = executorFor(client).execute(plan, ARTIFACT);

        verify(client, times(1)).submit(anyList(), any());
        Assertions.assertEquals(StageState.COMPLETED, outcome.getStageStates().get(1));
        Assertions.assertEquals(StageState.SKIPPED, outcome.getStageStates().get(2));
        Assertions.assertFalse(outcome.getRoutingRecords().get(2).isExecuted());
        Assertions.assertEquals(1, outcome.getReports().size());
    }

    @Test
    public void testFailedStageDoesNotAbortRun() {
        ScriptedAnalysisClient client = new ScriptedAnalysisClient()
                .report("ClamAV", "{\"malicious\": false}")
                .failJobContaining("Yara");

        ConditionDescriptor condition = malicious("ClamAV");
        ExecutionPlan plan = new ExecutionPlan("src", List.of(
                new Stage(0, List.of("ClamAV"), null, List.of(), List.of(), "stage 0"),
                new Stage(1, List.of("Quark_Engine"), condition, List.of("alert"), List.of(0), "true"),
                new Stage(2, List.of("Yara"), condition.negated(), List.of("archive"), List.of(0), "false")));

        ExecutionOutcome outcome = executorFor(client).execute(plan, ARTIFACT);

        Assertions.assertEquals(StageState.SKIPPED, outcome.getStageStates().get(1));
        Assertions.assertEquals(StageState.FAILED, outcome.getStageStates().get(2));
        RoutingRecord failed = outcome.getRoutingRecords().get(2);
        Assertions.assertFalse(failed.isExecuted());
        Assertions.assertTrue(failed.getDetail().contains("failed"));
        Assertions.assertEquals(RunStatus.FAILED, outcome.getOverallStatus());
        Assertions.assertEquals(List.of(List.of("ClamAV"), List.of("Yara")), client.getSubmissions());
    }

    @Test
    public void testNestedBranchCascadesSkip() {
        ScriptedAnalysisClient client = new ScriptedAnalysisClient()
                .report("ClamAV", "{\"malicious\": false}");

        ConditionDescriptor outer = malicious("ClamAV");
        // 内层条件取反后在缺少 Yara 报告时为 true, 但外层 true 分支未执行
        ConditionDescriptor inner = ConditionDescriptor.builder()
                .kind(ConditionKind.YARA_RULE_MATCH).sourceTask("Yara").build();
        ExecutionPlan plan = new ExecutionPlan("src", List.of(
                new Stage(0, List.of("ClamAV"), null, List.of(), List.of(), "stage 0"),
                new Stage(1, List.of("Yara"), outer, List.of(), List.of(0), "outer true"),
                new Stage(2, List.of(), outer.negated(), List.of("clean"), List.of(0), "outer false"),
                new Stage(3, List.of(), inner, List.of("hit"), List.of(1), "inner true"),
                new Stage(4, List.of(), inner.negated(), List.of("miss"), List.of(1), "inner false")));

        ExecutionOutcome outcome = executorFor(client).execute(plan, ARTIFACT);

        Assertions.assertEquals(StageState.SKIPPED, outcome.getStageStates().get(1));
        Assertions.assertEquals(StageState.COMPLETED, outcome.getStageStates().get(2));
        Assertions.assertEquals(StageState.SKIPPED, outcome.getStageStates().get(3));
        Assertions.assertEquals(StageState.SKIPPED, outcome.getStageStates().get(4), "上游未完成时应级联跳过");
    }

    @Test
    public void testAbortStopsBetweenStages() {
        AbortSignal signal = new AbortSignal();
        ScriptedAnalysisClient client = new ScriptedAnalysisClient() {
            @Override
            public synchronized String submit(List<String> taskNames, byte[] artifact) {
                // 第一个批次提交后立即请求中止
                signal.abort();
                return super.submit(taskNames, artifact);
            }
        };

        ExecutionPlan plan = new ExecutionPlan("src", List.of(
                new Stage(0, List.of("ClamAV"), null, List.of("s0"), List.of(), "stage 0"),
                new Stage(1, List.of("Yara"), malicious("ClamAV").negated(), List.of("s1"), List.of(0), "false")));

        ExecutionOutcome outcome = executorFor(client).execute(plan, ARTIFACT, signal);

        Assertions.assertTrue(outcome.isAborted());
        Assertions.assertEquals(StageState.COMPLETED, outcome.getStageStates().get(0), "进行中的批次正常完成");
        Assertions.assertEquals(StageState.PENDING, outcome.getStageStates().get(1));
        Assertions.assertEquals(1, outcome.getRoutingRecords().size());
        Assertions.assertEquals(RunStatus.ABORTED, outcome.getOverallStatus());
    }

    @Test
    public void testAlreadyReportedTasksAreNotResubmitted() {
        ScriptedAnalysisClient client = new ScriptedAnalysisClient()
                .report("ClamAV", "{\"malicious\": true}");

        ConditionDescriptor condition = malicious("ClamAV");
        ExecutionPlan plan = new ExecutionPlan("src", List.of(
                new Stage(0, List.of("ClamAV"), null, List.of(), List.of(), "stage 0"),
                new Stage(1, List.of("ClamAV", "Yara"), condition, List.of("alert"), List.of(0), "true")));

        executorFor(client).execute(plan, ARTIFACT);

        Assertions.assertEquals(List.of(List.of("ClamAV"), List.of("Yara")), client.getSubmissions());
    }

    @Test
    public void testNullPollStatusFailsOnlyThatStage() {
        AnalysisClient client = mock(AnalysisClient.class);
        when(client.submit(anyList(), any())).thenReturn("job-1");
        when(client.poll("job-1")).thenReturn(null);

        ConditionDescriptor condition = malicious("ClamAV");
        ExecutionPlan plan = new ExecutionPlan("src", List.of(
                new Stage(0, List.of("ClamAV"), null, List.of(), List.of(), "stage 0"),
                new Stage(1, List.of(), condition, List.of("alert"), List.of(0), "true"),
                new Stage(2, List.of(), condition.negated(), List.of("archive"), List.of(0), "false")));

        ExecutionOutcome outcome = executorFor(client).execute(plan, ARTIFACT);

        Assertions.assertEquals(StageState.FAILED, outcome.getStageStates().get(0));
        Assertions.assertEquals(3, outcome.getRoutingRecords().size(), "后续 Stage 仍然执行");
        Assertions.assertEquals(StageState.SKIPPED, outcome.getStageStates().get(1));
        Assertions.assertEquals(StageState.COMPLETED, outcome.getStageStates().get(2));
        Assertions.assertEquals(RunStatus.FAILED, outcome.getOverallStatus());
    }
}
