package cn.hjw.dev.threatflow.engine;

import cn.hjw.dev.threatflow.client.JobPoller;
import cn.hjw.dev.threatflow.client.ResilientAnalysisClient;
import cn.hjw.dev.threatflow.compile.ExecutionPlan;
import cn.hjw.dev.threatflow.compile.StageCompiler;
import cn.hjw.dev.threatflow.config.EngineConfig;
import cn.hjw.dev.threatflow.executor.AbortSignal;
import cn.hjw.dev.threatflow.executor.ExecutionOutcome;
import cn.hjw.dev.threatflow.executor.StageExecutor;
import cn.hjw.dev.threatflow.model.WorkflowGraph;
import cn.hjw.dev.threatflow.route.ResultRouter;
import cn.hjw.dev.threatflow.route.SinkResult;
import cn.hjw.dev.threatflow.validate.GraphValidator;
import cn.hjw.dev.threatflow.validate.ValidationReport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;

/**
 * 校验 -> 编译 在构造时完成, 每次 apply 执行 -> 路由
 * <p>
 * 图非法时构造直接抛出 GraphValidationException, 不会调用分析服务。
 */
@Slf4j
public class WorkflowEngine implements ExecutableWorkflow {

    private final WorkflowGraph graph;

    @Getter
    private final ExecutionPlan plan;

    @Getter
    private final ValidationReport validationReport;

    private final StageExecutor executor;
    private final ResultRouter router = new ResultRouter();

    public WorkflowEngine(WorkflowGraph graph, EngineConfig config) {
        Objects.requireNonNull(config.getAnalysisClient(), "analysisClient must not be null");
        this.graph = graph;

        // 校验
        this.validationReport = new GraphValidator(config.getTaskCatalog()).validateOrThrow(graph);
        // 编译
        this.plan = new StageCompiler().compile(graph);
        log.info("Workflow compiled into {} stages (conditional: {})", plan.getStages().size(), plan.hasConditionals());

        // 创建执行器
        JobPoller poller = new JobPoller(
                new ResilientAnalysisClient(config.getAnalysisClient(), config.getGovernance()),
                config.getGovernance());
        this.executor = new StageExecutor(poller, config.getConditionEvaluator());
    }

    @Override
    public WorkflowRunResult apply(byte[] artifact) {
        return apply(artifact, AbortSignal.none());
    }

    public WorkflowRunResult apply(byte[] artifact, AbortSignal abortSignal) {
        ExecutionOutcome outcome = executor.execute(plan, artifact, abortSignal);
        Map<String, SinkResult> sinkResults = router.route(graph, outcome.getReports(),
                outcome.getRoutingRecords(), outcome.isAborted());
        log.info("Workflow run finished with status {}", outcome.getOverallStatus());
        return new WorkflowRunResult(outcome.getOverallStatus(), outcome.getRoutingRecords(),
                sinkResults, outcome.getReports());
    }
}
