package cn.hjw.dev.threatflow.compile;

import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 编译后的执行单元: 一组任务 (可以为空) + 可选的分支条件
 * <p>
 * taskNames 为空的 Stage 是 "纯路由" Stage: 不调用外部服务, 但仍参与跳过判定与 Sink 记账。
 */
@Getter
@ToString
public class Stage {

    private final int id;
    private final List<String> taskNames;

    // Stage 0 为 null
    private final ConditionDescriptor condition;

    private final List<String> targetSinkIds;

    // 走到该分支的上游 Stage, 至少一个完成才有资格执行
    private final List<Integer> parentStageIds;

    private final String description;

    public Stage(int id, List<String> taskNames, ConditionDescriptor condition, List<String> targetSinkIds,
                 List<Integer> parentStageIds, String description) {
        this.id = id;
        this.taskNames = List.copyOf(taskNames);
        this.condition = condition;
        this.targetSinkIds = List.copyOf(targetSinkIds);
        this.parentStageIds = List.copyOf(parentStageIds);
        this.description = description;
    }

    public boolean isRoutingOnly() {
        return taskNames.isEmpty();
    }

    public boolean isConditional() {
        return condition != null;
    }

    /**
     * 条件依赖的任务名
     */
    public String getDependsOn() {
        return condition != null ? condition.getSourceTask() : null;
    }
}
