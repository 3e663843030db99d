package cn.hjw.dev.threatflow.engine;

import cn.hjw.dev.threatflow.executor.RoutingRecord;
import cn.hjw.dev.threatflow.executor.RunStatus;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import cn.hjw.dev.threatflow.route.SinkResult;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@ToString
public class WorkflowRunResult {

    private final RunStatus overallStatus;
    private final List<RoutingRecord> routingRecords;

    // Key: sinkId, 按图中声明顺序
    private final Map<String, SinkResult> sinkResults;

    // 本次运行产生的全部报告
    private final List<ExecutionReport> reports;

    public WorkflowRunResult(RunStatus overallStatus, List<RoutingRecord> routingRecords,
                             Map<String, SinkResult> sinkResults, List<ExecutionReport> reports) {
        this.overallStatus = overallStatus;
        this.routingRecords = List.copyOf(routingRecords);
        this.sinkResults = Collections.unmodifiableMap(new LinkedHashMap<>(sinkResults));
        this.reports = List.copyOf(reports);
    }

    public SinkResult getSinkResult(String sinkId) {
        return sinkResults.get(sinkId);
    }
}
