package cn.hjw.dev.threatflow.compile;

import cn.hjw.dev.threatflow.model.BranchLabel;
import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import cn.hjw.dev.threatflow.model.NodeKind;
import cn.hjw.dev.threatflow.model.WorkflowEdge;
import cn.hjw.dev.threatflow.model.WorkflowGraph;
import cn.hjw.dev.threatflow.model.WorkflowNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 把 (已校验的) 分支图编译成有序的 Stage 列表
 * <p>
 * 1. Stage 0: 从 Source 出发、不经过 Branch 可达的所有任务
 * 2. 按拓扑序处理每个 Branch, 生成 TRUE / FALSE 两个 Stage (FALSE 为同一条件取反)
 * 3. 每个 Stage 的任务集合在遇到 Sink 或下一个 Branch 时终止
 */
@Slf4j
public class StageCompiler {

    public ExecutionPlan compile(WorkflowGraph graph) {
        List<WorkflowNode> sources = graph.sourceNodes();
        if (sources.size() != 1) {
            throw new IllegalStateException("Graph must have exactly one source node, found " + sources.size());
        }
        String sourceId = sources.get(0).getId();
        List<String> topoOrder = topologicalOrder(graph);

        List<Stage> stages = new ArrayList<>();
        // Branch -> 走到它的 Stage
        Map<String, Set<Integer>> branchParents = new LinkedHashMap<>();

        // 1. Stage 0
        Walk root = walk(graph, graph.outgoing(sourceId).stream().map(WorkflowEdge::getTargetNodeId).collect(Collectors.toList()),
                Set.of());
        Set<String> stageZeroTasks = new LinkedHashSet<>(root.tasks);
        stages.add(new Stage(0, new ArrayList<>(root.tasks), null, new ArrayList<>(root.sinks), List.of(),
                "Pre-conditional analysis"));
        root.branches.forEach(b -> branchParents.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(0));

        // 2. 按拓扑序展开 Branch, 保证所有可能走到它的 Stage 都已生成
        for (String nodeId : topoOrder) {
            WorkflowNode node = graph.getNode(nodeId);
            if (!node.is(NodeKind.BRANCH) || !branchParents.containsKey(nodeId)) {
                continue;
            }
            ConditionDescriptor condition = resolveCondition(graph, node);
            List<Integer> parents = new ArrayList<>(branchParents.get(nodeId));

            for (BranchLabel label : BranchLabel.values()) {
                String target = graph.branchTarget(nodeId, label).orElse(null);
                List<String> start = target != null ? List.of(target) : List.of();
                Walk branchWalk = walk(graph, start, stageZeroTasks);

                int stageId = stages.size();
                ConditionDescriptor stageCondition = condition.withNegate(label == BranchLabel.FALSE_BRANCH);
                stages.add(new Stage(stageId, new ArrayList<>(branchWalk.tasks), stageCondition,
                        new ArrayList<>(branchWalk.sinks), parents,
                        "Branch " + nodeId + " " + label.getWireName() + ": " + stageCondition.describe()));
                branchWalk.branches.forEach(b ->
                        branchParents.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(stageId));

                log.info("Compiled stage [{}] for branch [{}] ({}): tasks={}, sinks={}",
                        stageId, nodeId, label.getWireName(), branchWalk.tasks, branchWalk.sinks);
            }
        }

        log.info("Compiled workflow into {} stages", stages.size());
        return new ExecutionPlan(sourceId, stages);
    }

    // BFS: 穿过 Task, 在 Sink / Branch 处停下
    private Walk walk(WorkflowGraph graph, List<String> startIds, Set<String> excludedTasks) {
        Walk result = new Walk();
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        for (String id : startIds) {
            if (visited.add(id)) {
                queue.offer(id);
            }
        }

        while (!queue.isEmpty()) {
            WorkflowNode node = graph.getNode(queue.poll());
            switch (node.getKind()) {
                case SINK:
                    result.sinks.add(node.getId());
                    break;
                case BRANCH:
                    result.branches.add(node.getId());
                    break;
                case TASK:
                    // 多条路径汇入同一任务时只提交一次
                    if (!excludedTasks.contains(node.getTaskName())) {
                        result.tasks.add(node.getTaskName());
                    }
                    for (WorkflowEdge edge : graph.outgoing(node.getId())) {
                        if (visited.add(edge.getTargetNodeId())) {
                            queue.offer(edge.getTargetNodeId());
                        }
                    }
                    break;
                default:
                    // 已校验的图中 Source 不会出现在后继里
                    break;
            }
        }
        return result;
    }

    // true 分支固定 negate=false, false 分支固定 negate=true, 两者互斥
    private ConditionDescriptor resolveCondition(WorkflowGraph graph, WorkflowNode branch) {
        ConditionDescriptor condition = branch.getCondition();
        if (condition.isNegate()) {
            log.warn("Branch [{}] condition carries negate=true, ignored; use the false-branch edge instead", branch.getId());
            condition = condition.withNegate(false);
        }
        if (condition.hasSourceTask()) {
            return condition;
        }
        final ConditionDescriptor resolved = condition;
        return graph.nearestUpstreamTask(branch.getId())
                .map(task -> {
                    log.info("Branch [{}] has no source task, defaulting to upstream task [{}]", branch.getId(), task);
                    return resolved.withSourceTask(task);
                })
                .orElse(resolved);
    }

    /**
     * Kahn 算法求拓扑序, 同时做环检测
     */
    private List<String> topologicalOrder(WorkflowGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        graph.getNodes().keySet().forEach(id -> inDegree.put(id, graph.incoming(id).size()));

        Queue<String> queue = new ArrayDeque<>();
        // 按插入顺序入队, 保证编译结果稳定
        graph.getNodes().keySet().forEach(id -> {
            if (inDegree.get(id) == 0) queue.offer(id);
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String node = queue.poll();
            order.add(node);
            for (WorkflowEdge edge : graph.outgoing(node)) {
                String child = edge.getTargetNodeId();
                inDegree.put(child, inDegree.get(child) - 1);
                if (inDegree.get(child) == 0) {
                    queue.offer(child);
                }
            }
        }

        if (order.size() != graph.getNodes().size()) {
            throw new IllegalStateException("Workflow cycle detected!");
        }
        return order;
    }

    // 一次遍历的结果
    private static class Walk {
        private final Set<String> tasks = new LinkedHashSet<>();
        private final Set<String> sinks = new LinkedHashSet<>();
        private final Set<String> branches = new LinkedHashSet<>();
    }
}
