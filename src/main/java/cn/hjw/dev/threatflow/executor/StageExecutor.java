package cn.hjw.dev.threatflow.executor;

import cn.hjw.dev.threatflow.client.JobPoller;
import cn.hjw.dev.threatflow.compile.ExecutionPlan;
import cn.hjw.dev.threatflow.compile.Stage;
import cn.hjw.dev.threatflow.condition.ConditionEvaluator;
import cn.hjw.dev.threatflow.condition.EvaluationOutcome;
import cn.hjw.dev.threatflow.exception.StageExecutionException;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 按编译顺序串行执行 Stage
 * <p>
 * 不并行执行相互独立的 Stage; 每个 Stage 的批次调用是唯一的挂起点。
 * 单个 Stage 失败不会中止运行, 后续 Stage 继续使用已有报告。
 */
@Slf4j
@RequiredArgsConstructor
public class StageExecutor {

    private final JobPoller jobPoller;
    private final ConditionEvaluator conditionEvaluator;

    public ExecutionOutcome execute(ExecutionPlan plan, byte[] artifact) {
        return execute(plan, artifact, AbortSignal.none());
    }

    public ExecutionOutcome execute(ExecutionPlan plan, byte[] artifact, AbortSignal abortSignal) {
        // 报告集合由执行器独占, 条件求值只读快照
        Map<String, ExecutionReport> reports = new LinkedHashMap<>();
        List<RoutingRecord> records = new ArrayList<>();
        Map<Integer, StageState> states = new LinkedHashMap<>();
        plan.getStages().forEach(s -> states.put(s.getId(), StageState.PENDING));

        boolean aborted = false;
        for (Stage stage : plan.getStages()) {
            if (abortSignal.isAborted()) {
                log.warn("Run aborted before stage [{}], {} stages not visited", stage.getId(),
                        plan.getStages().size() - stage.getId());
                aborted = true;
                break;
            }
            RoutingRecord record = runStage(stage, artifact, reports, states);
            states.put(stage.getId(), record.getState());
            records.add(record);
        }

        return new ExecutionOutcome(new ArrayList<>(reports.values()), records, states, aborted);
    }

    private RoutingRecord runStage(Stage stage, byte[] artifact, Map<String, ExecutionReport> reports,
                                   Map<Integer, StageState> states) {
        // 1. 检查条件 (Stage 0 无条件, 直接执行)
        if (stage.isConditional()) {
            if (!anyParentReached(stage, states)) {
                // 级联剪枝: 上游 Stage 都被跳过, 当前分支也跳过
                String detail = "parent stages " + stage.getParentStageIds() + " were not executed";
                log.info("Stage [{}] skipped because {}.", stage.getId(), detail);
                return record(stage, StageState.SKIPPED, detail);
            }
            EvaluationOutcome outcome = conditionEvaluator.explain(stage.getCondition(),
                    List.copyOf(reports.values()));
            log.info("Stage [{}] condition {} evaluated to {} via {}.", stage.getId(),
                    stage.getCondition().describe(), outcome.isResult(), outcome.getTier());
            if (!outcome.isResult()) {
                return record(stage, StageState.SKIPPED,
                        "condition " + stage.getCondition().describe() + " not met (" + outcome.getTier() + ")");
            }
        }

        // 2. 执行 (RUNNING)
        List<String> pending = stage.getTaskNames().stream()
                .filter(t -> !reports.containsKey(t))
                .collect(Collectors.toList());
        if (pending.isEmpty()) {
            // 纯路由 Stage 绝不能提交空任务列表
            log.info("Stage [{}] has no tasks to submit, routing to {}.", stage.getId(), stage.getTargetSinkIds());
            return record(stage, StageState.COMPLETED, stage.isRoutingOnly() ? "routing only" : "tasks already reported");
        }

        states.put(stage.getId(), StageState.RUNNING);
        try {
            List<ExecutionReport> batch = jobPoller.runBatch(stage.getId(), pending, artifact);
            batch.forEach(r -> reports.putIfAbsent(r.getTaskName(), r));
            long failures = batch.stream().filter(r -> !r.isSuccess()).count();
            log.info("Stage [{}] completed: {} reports ({} failed tasks).", stage.getId(), batch.size(), failures);
            return record(stage, StageState.COMPLETED, null);
        } catch (StageExecutionException e) {
            log.error("Stage [{}] failed: {}", stage.getId(), e.getMessage());
            return record(stage, StageState.FAILED, e.getMessage());
        }
    }

    // 失败的上游同样算 "已到达", 下游按已有报告继续求值
    private boolean anyParentReached(Stage stage, Map<Integer, StageState> states) {
        Set<Integer> parents = Set.copyOf(stage.getParentStageIds());
        if (parents.isEmpty()) {
            return true;
        }
        return parents.stream().map(states::get)
                .anyMatch(state -> state == StageState.COMPLETED || state == StageState.FAILED);
    }

    private RoutingRecord record(Stage stage, StageState state, String detail) {
        return new RoutingRecord(stage.getId(), stage.getTargetSinkIds(), stage.getTaskNames(), state, detail);
    }
}
