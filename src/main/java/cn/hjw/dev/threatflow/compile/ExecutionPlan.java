package cn.hjw.dev.threatflow.compile;

import lombok.Getter;

import java.util.List;

@Getter
public class ExecutionPlan {

    private final String sourceNodeId;

    // 按编译顺序排列, id 从 0 连续递增
    private final List<Stage> stages;

    public ExecutionPlan(String sourceNodeId, List<Stage> stages) {
        this.sourceNodeId = sourceNodeId;
        this.stages = List.copyOf(stages);
    }

    public Stage getStage(int stageId) {
        return stages.get(stageId);
    }

    public boolean hasConditionals() {
        return stages.stream().anyMatch(Stage::isConditional);
    }
}
