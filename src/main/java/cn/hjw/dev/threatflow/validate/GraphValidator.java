package cn.hjw.dev.threatflow.validate;

import cn.hjw.dev.threatflow.catalog.TaskCatalog;
import cn.hjw.dev.threatflow.model.BranchLabel;
import cn.hjw.dev.threatflow.model.NodeKind;
import cn.hjw.dev.threatflow.model.WorkflowEdge;
import cn.hjw.dev.threatflow.model.WorkflowGraph;
import cn.hjw.dev.threatflow.model.WorkflowNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * 图结构校验 (纯函数, 无副作用)
 * <p>
 * 按顺序检查:
 * 1. 恰好一个 Source
 * 2. 从 Source 出发无环
 * 3. 所有非 Source 节点都可从 Source 到达
 * 4. 每个 Branch 恰好有 true-branch / false-branch 两条出边
 * <p>
 * 某一类检查失败即停止, 返回该类的全部违规项。
 */
@Slf4j
public class GraphValidator {

    // 可选, 用于提示未知任务名
    private final TaskCatalog taskCatalog;

    public GraphValidator() {
        this(null);
    }

    public GraphValidator(TaskCatalog taskCatalog) {
        this.taskCatalog = taskCatalog;
    }

    public ValidationReport validate(WorkflowGraph graph) {
        List<GraphViolation> errors = checkSingleSource(graph);
        if (errors.isEmpty()) {
            String sourceId = graph.sourceNodes().get(0).getId();
            errors = checkNoCycle(graph, sourceId);
            if (errors.isEmpty()) {
                errors = checkReachability(graph, sourceId);
            }
            if (errors.isEmpty()) {
                errors = checkBranches(graph);
            }
        }

        List<ValidationWarning> warnings = errors.isEmpty() ? collectWarnings(graph) : List.of();
        if (!errors.isEmpty()) {
            log.warn("Workflow graph rejected: {}", errors.get(0).getMessage());
        }
        warnings.forEach(w -> log.warn("Workflow graph warning at [{}]: {}", w.getNodeId(), w.getMessage()));
        return new ValidationReport(errors, warnings);
    }

    /**
     * @return 校验通过时的报告 (可能带警告)
     */
    public ValidationReport validateOrThrow(WorkflowGraph graph) {
        ValidationReport report = validate(graph);
        report.throwIfInvalid();
        return report;
    }

    private List<GraphViolation> checkSingleSource(WorkflowGraph graph) {
        List<WorkflowNode> sources = graph.sourceNodes();
        if (sources.isEmpty()) {
            return List.of(new GraphViolation(GraphError.NO_SOURCE_NODE, null,
                    "Workflow must contain a source node"));
        }
        if (sources.size() > 1) {
            List<GraphViolation> errors = new ArrayList<>();
            for (WorkflowNode source : sources) {
                errors.add(new GraphViolation(GraphError.MULTIPLE_SOURCE_NODES, source.getId(),
                        "Workflow must contain exactly one source node, found " + sources.size()));
            }
            return errors;
        }
        return List.of();
    }

    // 三色 DFS: 0 未访问, 1 在栈上, 2 已完成
    private List<GraphViolation> checkNoCycle(WorkflowGraph graph, String sourceId) {
        Map<String, Integer> color = new HashMap<>();
        List<GraphViolation> errors = new ArrayList<>();
        ArrayDeque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(sourceId));
        color.put(sourceId, 1);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<WorkflowEdge> out = graph.outgoing(frame.nodeId);
            if (frame.next < out.size()) {
                String child = out.get(frame.next++).getTargetNodeId();
                int c = color.getOrDefault(child, 0);
                if (c == 1) {
                    errors.add(new GraphViolation(GraphError.CYCLE_DETECTED, child,
                            "Cycle detected through node " + child));
                    return errors;
                }
                if (c == 0) {
                    color.put(child, 1);
                    stack.push(new Frame(child));
                }
            } else {
                color.put(frame.nodeId, 2);
                stack.pop();
            }
        }
        return errors;
    }

    private List<GraphViolation> checkReachability(WorkflowGraph graph, String sourceId) {
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.offer(sourceId);
        visited.add(sourceId);
        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            for (WorkflowEdge edge : graph.outgoing(nodeId)) {
                if (visited.add(edge.getTargetNodeId())) {
                    queue.offer(edge.getTargetNodeId());
                }
            }
        }

        List<GraphViolation> errors = new ArrayList<>();
        for (String nodeId : graph.getNodes().keySet()) {
            if (!visited.contains(nodeId)) {
                errors.add(new GraphViolation(GraphError.UNREACHABLE_NODE, nodeId,
                        "Node " + nodeId + " is not reachable from the source node"));
            }
        }
        return errors;
    }

    private List<GraphViolation> checkBranches(WorkflowGraph graph) {
        List<GraphViolation> errors = new ArrayList<>();
        for (WorkflowNode branch : graph.nodesOfKind(NodeKind.BRANCH)) {
            int trueEdges = 0;
            int falseEdges = 0;
            int unlabeled = 0;
            for (WorkflowEdge edge : graph.outgoing(branch.getId())) {
                if (edge.getLabel() == BranchLabel.TRUE_BRANCH) {
                    trueEdges++;
                } else if (edge.getLabel() == BranchLabel.FALSE_BRANCH) {
                    falseEdges++;
                } else {
                    unlabeled++;
                }
            }
            if (trueEdges != 1 || falseEdges != 1 || unlabeled != 0) {
                errors.add(new GraphViolation(GraphError.MALFORMED_BRANCH, branch.getId(),
                        String.format("Branch %s needs exactly one true-branch and one false-branch edge"
                                + " (found true=%d, false=%d, unlabeled=%d)",
                                branch.getId(), trueEdges, falseEdges, unlabeled)));
            }
        }
        return errors;
    }

    private List<ValidationWarning> collectWarnings(WorkflowGraph graph) {
        List<ValidationWarning> warnings = new ArrayList<>();
        if (taskCatalog != null) {
            for (WorkflowNode task : graph.nodesOfKind(NodeKind.TASK)) {
                if (!taskCatalog.isKnown(task.getTaskName())) {
                    warnings.add(new ValidationWarning(task.getId(),
                            "Task " + task.getTaskName() + " is not offered by the analysis service"));
                }
            }
        }
        for (WorkflowNode branch : graph.nodesOfKind(NodeKind.BRANCH)) {
            if (!branch.getCondition().hasSourceTask()
                    && graph.nearestUpstreamTask(branch.getId()).isEmpty()) {
                warnings.add(new ValidationWarning(branch.getId(),
                        "Branch condition has no source task and no task feeds it; it will always take the false branch"));
            }
        }
        return warnings;
    }

    // --- 迭代 DFS 的栈帧 ---
    private static class Frame {
        private final String nodeId;
        private int next;

        Frame(String nodeId) {
            this.nodeId = nodeId;
        }
    }
}
