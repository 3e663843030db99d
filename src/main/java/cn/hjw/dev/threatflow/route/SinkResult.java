package cn.hjw.dev.threatflow.route;

import cn.hjw.dev.threatflow.report.ExecutionReport;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sink 的最终结果: 过滤后的报告列表, 或 "未执行" 及原因, 二者必居其一
 */
@Getter
@ToString
@EqualsAndHashCode
public class SinkResult {

    public enum Kind { FILTERED_REPORTS, NOT_EXECUTED }

    private final Kind kind;
    private final List<ExecutionReport> reports;
    private final String reason;

    private SinkResult(Kind kind, List<ExecutionReport> reports, String reason) {
        this.kind = kind;
        this.reports = reports;
        this.reason = reason;
    }

    public static SinkResult filteredReports(List<ExecutionReport> reports) {
        return new SinkResult(Kind.FILTERED_REPORTS, List.copyOf(reports), null);
    }

    public static SinkResult notExecuted(String reason) {
        return new SinkResult(Kind.NOT_EXECUTED, List.of(), reason);
    }

    public boolean isExecuted() {
        return kind == Kind.FILTERED_REPORTS;
    }

    public List<String> taskNames() {
        return reports.stream().map(ExecutionReport::getTaskName).collect(Collectors.toList());
    }
}
