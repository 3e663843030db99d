package cn.hjw.dev.threatflow.client;

import cn.hjw.dev.threatflow.report.ExecutionReport;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class JobStatus {

    private final JobState state;
    private final List<ExecutionReport> reports;

    // 失败原因, 仅 FAILED 时有意义
    private final String message;

    public JobStatus(JobState state, List<ExecutionReport> reports, String message) {
        this.state = state;
        this.reports = reports != null ? List.copyOf(reports) : List.of();
        this.message = message;
    }

    public static JobStatus running() {
        return new JobStatus(JobState.RUNNING, List.of(), null);
    }

    public static JobStatus completed(List<ExecutionReport> reports) {
        return new JobStatus(JobState.COMPLETED, reports, null);
    }

    public static JobStatus failed(String message) {
        return new JobStatus(JobState.FAILED, List.of(), message);
    }

    public boolean isRunning() {
        return state == JobState.RUNNING;
    }
}
