package cn.hjw.dev.threatflow.route;

import cn.hjw.dev.threatflow.executor.RoutingRecord;
import cn.hjw.dev.threatflow.executor.StageState;
import cn.hjw.dev.threatflow.model.NodeKind;
import cn.hjw.dev.threatflow.model.WorkflowEdge;
import cn.hjw.dev.threatflow.model.WorkflowGraph;
import cn.hjw.dev.threatflow.model.WorkflowNode;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 把报告分发到各个 Sink
 * <p>
 * 策略 1 (RoutingRecord): 决定 Sink 是否执行
 * 策略 2 (原图 DFS): 决定 Sink 收到哪些任务的报告
 * <p>
 * 两者不能混用: Stage 的 targetSinkIds 只说明分支是否走过,
 * 菱形 / 共享祖先时具体的任务归属由图结构重新计算。
 */
@Slf4j
public class ResultRouter {

    static final String REASON_BRANCH_NOT_TAKEN = "branch not executed (conditional path not taken)";
    static final String REASON_ABORTED = "run aborted";
    static final String REASON_UNREACHED = "no stage reached this sink";

    public Map<String, SinkResult> route(WorkflowGraph graph, List<ExecutionReport> reports,
                                         List<RoutingRecord> records) {
        return route(graph, reports, records, false);
    }

    public Map<String, SinkResult> route(WorkflowGraph graph, List<ExecutionReport> reports,
                                         List<RoutingRecord> records, boolean aborted) {
        Map<String, SinkResult> results = new LinkedHashMap<>();
        List<WorkflowNode> sources = graph.sourceNodes();
        String sourceId = sources.isEmpty() ? null : sources.get(0).getId();

        // 策略 1: 已执行的 Sink 集合
        Set<String> executedSinks = records.stream()
                .filter(RoutingRecord::isExecuted)
                .flatMap(r -> r.getTargetSinkIds().stream())
                .collect(Collectors.toSet());

        for (WorkflowNode sink : graph.nodesOfKind(NodeKind.SINK)) {
            String sinkId = sink.getId();
            if (!executedSinks.contains(sinkId)) {
                String reason = notExecutedReason(sinkId, records, aborted);
                log.info("Sink [{}] not executed: {}", sinkId, reason);
                results.put(sinkId, SinkResult.notExecuted(reason));
                continue;
            }

            // 策略 2: Source -> Sink 所有路径上的任务并集
            Set<String> pathTasks = sourceId != null ? findTasksOnPaths(graph, sourceId, sinkId) : Set.of();
            List<ExecutionReport> filtered = reports.stream()
                    .filter(r -> pathTasks.contains(r.getTaskName()))
                    .collect(Collectors.toList());
            if (pathTasks.isEmpty()) {
                // 直连 Source -> Sink 等情况, 空列表是合法结果
                log.info("Sink [{}] has no task on any path from the source", sinkId);
            } else {
                log.info("Sink [{}] receives {} reports from tasks {}", sinkId, filtered.size(), pathTasks);
            }
            results.put(sinkId, SinkResult.filteredReports(filtered));
        }
        return results;
    }

    private String notExecutedReason(String sinkId, List<RoutingRecord> records, boolean aborted) {
        List<RoutingRecord> targeting = records.stream()
                .filter(r -> r.getTargetSinkIds().contains(sinkId))
                .collect(Collectors.toList());
        for (RoutingRecord record : targeting) {
            if (record.getState() == StageState.FAILED) {
                return "stage " + record.getStageId() + " failed: " + record.getDetail();
            }
        }
        if (!targeting.isEmpty()) {
            return REASON_BRANCH_NOT_TAKEN;
        }
        return aborted ? REASON_ABORTED : REASON_UNREACHED;
    }

    /**
     * DFS 枚举 source 到 target 的所有简单路径, 收集路径上的任务名
     * <p>
     * visited 只对当前路径生效, 回溯时移除, 允许同一节点出现在多条路径上。
     */
    Set<String> findTasksOnPaths(WorkflowGraph graph, String sourceId, String targetId) {
        List<List<String>> paths = new ArrayList<>();
        dfs(graph, sourceId, targetId, new HashSet<>(), new ArrayList<>(), paths);

        Set<String> tasks = new LinkedHashSet<>();
        paths.forEach(tasks::addAll);
        log.debug("Found {} path(s) from {} to {}: tasks {}", paths.size(), sourceId, targetId, tasks);
        return tasks;
    }

    private void dfs(WorkflowGraph graph, String nodeId, String targetId, Set<String> onPath,
                     List<String> pathTasks, List<List<String>> paths) {
        if (!onPath.add(nodeId)) {
            return;
        }
        WorkflowNode node = graph.getNode(nodeId);
        boolean isTask = node.is(NodeKind.TASK);
        if (isTask) {
            pathTasks.add(node.getTaskName());
        }

        if (nodeId.equals(targetId)) {
            paths.add(new ArrayList<>(pathTasks));
        } else if (!node.is(NodeKind.SINK)) {
            for (WorkflowEdge edge : graph.outgoing(nodeId)) {
                dfs(graph, edge.getTargetNodeId(), targetId, onPath, pathTasks, paths);
            }
        }

        // 回溯
        if (isTask) {
            pathTasks.remove(pathTasks.size() - 1);
        }
        onPath.remove(nodeId);
    }
}
