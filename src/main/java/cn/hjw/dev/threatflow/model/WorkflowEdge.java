package cn.hjw.dev.threatflow.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 有向边 source -> target, label 仅在分支出边上出现
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class WorkflowEdge {

    private final String sourceNodeId;
    private final String targetNodeId;
    private final BranchLabel label;

    public boolean isLabeled() {
        return label != null;
    }
}
