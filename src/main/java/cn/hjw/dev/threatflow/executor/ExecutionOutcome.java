package cn.hjw.dev.threatflow.executor;

import cn.hjw.dev.threatflow.report.ExecutionReport;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
public class ExecutionOutcome {

    private final List<ExecutionReport> reports;
    private final List<RoutingRecord> routingRecords;

    // Key: stageId
    private final Map<Integer, StageState> stageStates;

    private final boolean aborted;

    public ExecutionOutcome(List<ExecutionReport> reports, List<RoutingRecord> routingRecords,
                            Map<Integer, StageState> stageStates, boolean aborted) {
        this.reports = List.copyOf(reports);
        this.routingRecords = List.copyOf(routingRecords);
        this.stageStates = Collections.unmodifiableMap(new LinkedHashMap<>(stageStates));
        this.aborted = aborted;
    }

    /**
     * 取各 Stage 状态中最差的, 中止优先
     */
    public RunStatus getOverallStatus() {
        RunStatus status = RunStatus.COMPLETED;
        for (StageState state : stageStates.values()) {
            if (state == StageState.FAILED) {
                status = status.worst(RunStatus.FAILED);
            }
        }
        return aborted ? status.worst(RunStatus.ABORTED) : status;
    }
}
