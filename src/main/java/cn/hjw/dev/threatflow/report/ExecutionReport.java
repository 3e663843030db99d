package cn.hjw.dev.threatflow.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;

/**
 * 单个任务的分析报告, 每次运行中每个任务只产生一次
 * <p>
 * payload 是无模式的结构化数据 (对象 / 数组 / 标量)
 */
@Getter
@ToString
@EqualsAndHashCode
public class ExecutionReport {

    private final String taskName;
    private final ReportStatus status;
    private final JsonNode payload;
    private final List<String> errors;

    public ExecutionReport(String taskName, ReportStatus status, JsonNode payload, List<String> errors) {
        this.taskName = taskName;
        this.status = status;
        this.payload = payload != null ? payload : JsonNodeFactory.instance.objectNode();
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ExecutionReport success(String taskName, JsonNode payload) {
        return new ExecutionReport(taskName, ReportStatus.SUCCESS, payload, List.of());
    }

    public static ExecutionReport failure(String taskName, String... errors) {
        return new ExecutionReport(taskName, ReportStatus.FAILURE, null, Arrays.asList(errors));
    }

    public boolean isSuccess() {
        return status == ReportStatus.SUCCESS;
    }
}
