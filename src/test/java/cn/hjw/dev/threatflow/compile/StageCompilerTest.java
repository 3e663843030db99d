package cn.hjw.dev.threatflow.compile;

import cn.hjw.dev.threatflow.model.BranchLabel;
import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import cn.hjw.dev.threatflow.model.ConditionKind;
import cn.hjw.dev.threatflow.model.WorkflowGraph;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

@Slf4j
public class StageCompilerTest {

    private final StageCompiler compiler = new StageCompiler();

    private static ConditionDescriptor malicious(String task) {
        return ConditionDescriptor.builder().kind(ConditionKind.VERDICT_MALICIOUS).sourceTask(task).build();
    }

    @Test
    public void testNoBranchCompilesToSingleStage() {
        // Source -> A -> {B, C} -> D -> Sink, 任务名 B / C 重复出现
        WorkflowGraph graph = WorkflowGraph.builder()
                .addSource("src")
                .addTask("a", "File_Info")
                .addTask("b", "ClamAV")
                .addTask("c", "Yara")
                .addTask("c2", "ClamAV")
                .addSink("out")
                .addRoute("src", "a")
                .addRoute("a", "b")
                .addRoute("a", "c")
                .addRoute("b", "c2")
                .addRoute("c", "c2")
                .addRoute("c2", "out")
                .build();

        ExecutionPlan plan = compiler.compile(graph);

        Assertions.assertEquals(1, plan.getStages().size());
        Stage stage = plan.getStage(0);
        Assertions.assertNull(stage.getCondition());
        Assertions.assertEquals(Set.of("File_Info", "ClamAV", "Yara"), Set.copyOf(stage.getTaskNames()));
        Assertions.assertEquals(3, stage.getTaskNames().size(), "任务名应去重");
        Assertions.assertEquals(List.of("out"), stage.getTargetSinkIds());
        Assertions.assertFalse(plan.hasConditionals());
    }

    @Test
    public void testSimpleBranch() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .addSource("src")
                .addTask("clam", "ClamAV")
                .addBranch("check", malicious("ClamAV"))
                .addTask("deep", "Quark_Engine")
                .addSink("alert")
                .addSink("archive")
                .addRoute("src", "clam")
                .addRoute("clam", "check")
                .addBranchRoute("check", BranchLabel.TRUE_BRANCH, "deep")
                .addRoute("deep", "alert")
                .addBranchRoute("check", BranchLabel.FALSE_BRANCH, "archive")
                .build();

        ExecutionPlan plan = compiler.compile(graph);
        Assertions.assertEquals(3, plan.getStages().size());

        Stage trueStage = plan.getStage(1);
        Assertions.assertEquals(List.of("Quark_Engine"), trueStage.getTaskNames());
        Assertions.assertFalse(trueStage.getCondition().isNegate());
        Assertions.assertEquals("ClamAV", trueStage.getDependsOn());
        Assertions.assertEquals(List.of("alert"), trueStage.getTargetSinkIds());

        Stage falseStage = plan.getStage(2);
        Assertions.assertTrue(falseStage.isRoutingOnly(), "false 分支直连 Sink, 应为纯路由 Stage");
        Assertions.assertTrue(falseStage.getCondition().isNegate());
        Assertions.assertEquals(List.of("archive"), falseStage.getTargetSinkIds());
        Assertions.assertEquals(List.of(0), falseStage.getParentStageIds());
    }

    @Test
    public void testStageZeroExistsWhenSourceLeadsToBranch() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .addSource("src")
                .addBranch("check", malicious("ClamAV"))
                .addTask("clam", "ClamAV")
                .addSink("yes")
                .addSink("no")
                .addRoute("src", "check")
                .addBranchRoute("check", BranchLabel.TRUE_BRANCH, "clam")
                .addRoute("clam", "yes")
                .addBranchRoute("check", BranchLabel.FALSE_BRANCH, "no")
                .build();

        ExecutionPlan plan = compiler.compile(graph);

        Assertions.assertTrue(plan.getStage(0).isRoutingOnly());
        Assertions.assertNull(plan.getStage(0).getCondition());
        for (int i = 0; i < plan.getStages().size(); i++) {
            Assertions.assertEquals(i, plan.getStage(i).getId(), "Stage id 应连续");
        }
    }

    @Test
    public void testNestedBranchesCompileAfterParent() {
        // src -> clam -> b1 -(T)-> yara -> b2 -(T)-> sinkA / -(F)-> sinkB ; b1 -(F)-> sinkC
        WorkflowGraph graph = WorkflowGraph.builder()
                .addSource("src")
                .addTask("clam", "ClamAV")
                .addBranch("b1", malicious("ClamAV"))
                .addTask("yara", "Yara")
                .addBranch("b2", ConditionDescriptor.builder().kind(ConditionKind.YARA_RULE_MATCH).build())
                .addSink("sinkA")
                .addSink("sinkB")
                .addSink("sinkC")
                .addRoute("src", "clam")
                .addRoute("clam", "b1")
                .addBranchRoute("b1", BranchLabel.TRUE_BRANCH, "yara")
                .addBranchRoute("b1", BranchLabel.FALSE_BRANCH, "sinkC")
                .addRoute("yara", "b2")
                .addBranchRoute("b2", BranchLabel.TRUE_BRANCH, "sinkA")
                .addBranchRoute("b2", BranchLabel.FALSE_BRANCH, "sinkB")
                .build();

        ExecutionPlan plan = compiler.compile(graph);
        plan.getStages().forEach(s -> log.info("{}", s));

        Assertions.assertEquals(5, plan.getStages().size());
        Stage b2True = plan.getStage(3);
        Stage b2False = plan.getStage(4);
        Assertions.assertEquals(List.of(1), b2True.getParentStageIds(), "嵌套分支依赖外层 true Stage");
        // 缺省 sourceTask 取最近的上游任务
        Assertions.assertEquals("Yara", b2True.getDependsOn());
        Assertions.assertTrue(b2False.getCondition().isNegate());
        Assertions.assertEquals(List.of("sinkB"), b2False.getTargetSinkIds());
    }

    @Test
    public void testStageZeroTasksAreNotRepeatedInBranches() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .addSource("src")
                .addTask("clam", "ClamAV")
                .addTask("yara", "Yara")
                .addBranch("check", malicious("ClamAV"))
                .addSink("yes")
                .addSink("no")
                .addRoute("src", "clam")
                .addRoute("src", "yara")
                .addRoute("clam", "check")
                .addBranchRoute("check", BranchLabel.TRUE_BRANCH, "yara")
                .addRoute("yara", "yes")
                .addBranchRoute("check", BranchLabel.FALSE_BRANCH, "no")
                .build();

        ExecutionPlan plan = compiler.compile(graph);

        Assertions.assertTrue(plan.getStage(0).getTaskNames().contains("Yara"));
        Assertions.assertTrue(plan.getStage(1).getTaskNames().isEmpty());
        Assertions.assertEquals(List.of("yes"), plan.getStage(1).getTargetSinkIds());
    }

    @Test
    public void testBranchConditionIsNormalisedPerLabel() {
        // 分支自身带 negate=true 时, 两个 Stage 仍然一正一反
        WorkflowGraph graph = WorkflowGraph.builder()
                .addSource("src")
                .addTask("clam", "ClamAV")
                .addBranch("check", malicious("ClamAV").negated())
                .addSink("yes")
                .addSink("no")
                .addRoute("src", "clam")
                .addRoute("clam", "check")
                .addBranchRoute("check", BranchLabel.TRUE_BRANCH, "yes")
                .addBranchRoute("check", BranchLabel.FALSE_BRANCH, "no")
                .build();

        ExecutionPlan plan = compiler.compile(graph);

        Assertions.assertFalse(plan.getStage(1).getCondition().isNegate(), "true 分支应为 negate=false");
        Assertions.assertTrue(plan.getStage(2).getCondition().isNegate(), "false 分支应为 negate=true");
        Assertions.assertEquals("ClamAV", plan.getStage(2).getDependsOn());
    }
}
