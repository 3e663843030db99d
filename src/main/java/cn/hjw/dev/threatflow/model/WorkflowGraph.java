package cn.hjw.dev.threatflow.model;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 工作流图的不可变快照
 * <p>
 * 编辑器每次运行时交给内核一份快照, 内核与编辑器之间不共享可变对象。
 * 节点按稳定 id 索引, 保留插入顺序。
 */
public class WorkflowGraph {

    // 节点表 (Key: NodeId)
    @Getter
    private final Map<String, WorkflowNode> nodes;

    @Getter
    private final List<WorkflowEdge> edges;

    // 邻接表 (Key: Parent, Value: 出边)
    private final Map<String, List<WorkflowEdge>> outgoing;

    // 反向邻接表 (Key: Child, Value: 入边)
    private final Map<String, List<WorkflowEdge>> incoming;

    private WorkflowGraph(Map<String, WorkflowNode> nodes, List<WorkflowEdge> edges) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);

        Map<String, List<WorkflowEdge>> out = new LinkedHashMap<>();
        Map<String, List<WorkflowEdge>> in = new LinkedHashMap<>();
        nodes.keySet().forEach(id -> {
            out.put(id, new ArrayList<>());
            in.put(id, new ArrayList<>());
        });
        for (WorkflowEdge edge : edges) {
            out.get(edge.getSourceNodeId()).add(edge);
            in.get(edge.getTargetNodeId()).add(edge);
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        in.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WorkflowGraph empty() {
        return builder().build();
    }

    public WorkflowNode getNode(String nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return node;
    }

    public Optional<WorkflowNode> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<WorkflowEdge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<WorkflowEdge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public List<WorkflowNode> nodesOfKind(NodeKind kind) {
        return nodes.values().stream()
                .filter(n -> n.is(kind))
                .collect(Collectors.toList());
    }

    public List<WorkflowNode> sourceNodes() {
        return nodesOfKind(NodeKind.SOURCE);
    }

    /**
     * 分支节点指定标签的后继节点
     */
    public Optional<String> branchTarget(String branchId, BranchLabel label) {
        return outgoing(branchId).stream()
                .filter(e -> e.getLabel() == label)
                .map(WorkflowEdge::getTargetNodeId)
                .findFirst();
    }

    /**
     * 反向 BFS 寻找最近的上游任务名, 用于补全分支条件缺省的 sourceTask
     */
    public Optional<String> nearestUpstreamTask(String nodeId) {
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.offer(nodeId);
        visited.add(nodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (WorkflowEdge edge : incoming(current)) {
                WorkflowNode parent = nodes.get(edge.getSourceNodeId());
                if (parent.is(NodeKind.TASK)) {
                    return Optional.of(parent.getTaskName());
                }
                if (visited.add(parent.getId())) {
                    queue.offer(parent.getId());
                }
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * 图构建器, 只在构建阶段可变
     */
    public static class Builder {

        private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        private final List<WorkflowEdge> edges = new ArrayList<>();

        public Builder addNode(WorkflowNode node) {
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            }
            return this;
        }

        public Builder addSource(String nodeId) {
            return addNode(WorkflowNode.source(nodeId));
        }

        public Builder addTask(String nodeId, String taskName) {
            return addNode(WorkflowNode.task(nodeId, taskName));
        }

        public Builder addBranch(String nodeId, ConditionDescriptor condition) {
            return addNode(WorkflowNode.branch(nodeId, condition));
        }

        public Builder addSink(String nodeId) {
            return addNode(WorkflowNode.sink(nodeId));
        }

        /**
         * 添加普通边: fromNode -> toNode
         */
        public Builder addRoute(String fromNode, String toNode) {
            edges.add(new WorkflowEdge(fromNode, toNode, null));
            return this;
        }

        /**
         * 添加分支出边: branchNode -(label)-> toNode
         */
        public Builder addBranchRoute(String branchNode, BranchLabel label, String toNode) {
            edges.add(new WorkflowEdge(branchNode, toNode, label));
            return this;
        }

        public WorkflowGraph build() {
            for (WorkflowEdge edge : edges) {
                WorkflowNode from = nodes.get(edge.getSourceNodeId());
                if (from == null || !nodes.containsKey(edge.getTargetNodeId())) {
                    throw new IllegalArgumentException("Edge references unknown node: "
                            + edge.getSourceNodeId() + " -> " + edge.getTargetNodeId());
                }
                if (edge.isLabeled() && !from.is(NodeKind.BRANCH)) {
                    throw new IllegalArgumentException("Only branch edges may carry a label: "
                            + edge.getSourceNodeId() + " -> " + edge.getTargetNodeId());
                }
            }
            return new WorkflowGraph(nodes, edges);
        }
    }
}
