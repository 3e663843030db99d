package cn.hjw.dev.threatflow.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 图节点 (不可变)
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class WorkflowNode {

    private final String id;
    private final NodeKind kind;

    // 仅 TASK 节点有值
    private final String taskName;

    // 仅 BRANCH 节点有值
    private final ConditionDescriptor condition;

    public static WorkflowNode source(String id) {
        return new WorkflowNode(id, NodeKind.SOURCE, null, null);
    }

    public static WorkflowNode task(String id, String taskName) {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task node [" + id + "] must name a task");
        }
        return new WorkflowNode(id, NodeKind.TASK, taskName, null);
    }

    public static WorkflowNode branch(String id, ConditionDescriptor condition) {
        if (condition == null) {
            throw new IllegalArgumentException("Branch node [" + id + "] must carry a condition");
        }
        return new WorkflowNode(id, NodeKind.BRANCH, null, condition);
    }

    public static WorkflowNode sink(String id) {
        return new WorkflowNode(id, NodeKind.SINK, null, null);
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }
}
