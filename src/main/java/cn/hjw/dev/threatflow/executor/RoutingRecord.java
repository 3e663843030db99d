package cn.hjw.dev.threatflow.executor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 每个到达终态的 Stage 一条, 是路由器得知哪些分支被执行的唯一渠道
 */
@Getter
@ToString
@EqualsAndHashCode
public class RoutingRecord {

    private final int stageId;
    private final List<String> targetSinkIds;
    private final boolean executed;
    private final List<String> taskNames;
    private final StageState state;

    // 跳过或失败的原因
    private final String detail;

    public RoutingRecord(int stageId, List<String> targetSinkIds, List<String> taskNames,
                         StageState state, String detail) {
        this.stageId = stageId;
        this.targetSinkIds = List.copyOf(targetSinkIds);
        this.taskNames = List.copyOf(taskNames);
        this.state = state;
        this.executed = state == StageState.COMPLETED;
        this.detail = detail;
    }
}
