package cn.hjw.dev.threatflow.json;

import cn.hjw.dev.threatflow.engine.WorkflowRunResult;
import cn.hjw.dev.threatflow.executor.RoutingRecord;
import cn.hjw.dev.threatflow.executor.RunStatus;
import cn.hjw.dev.threatflow.executor.StageState;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import cn.hjw.dev.threatflow.route.SinkResult;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RunResultWriterTest {

    private final RunResultWriter writer = new RunResultWriter();

    private static WorkflowRunResult sampleResult(ExecutionReport report) {
        Map<String, SinkResult> sinks = new LinkedHashMap<>();
        sinks.put("alert", SinkResult.filteredReports(List.of(report)));
        sinks.put("archive", SinkResult.notExecuted("branch not executed (conditional path not taken)"));
        List<RoutingRecord> records = List.of(
                new RoutingRecord(0, List.of("alert"), List.of("ClamAV"), StageState.COMPLETED, null),
                new RoutingRecord(1, List.of("archive"), List.of(), StageState.SKIPPED, "condition not met"));
        return new WorkflowRunResult(RunStatus.COMPLETED, records, sinks, List.of(report));
    }

    @Test
    public void testWritesRunContract() {
        ExecutionReport report = ExecutionReport.success("ClamAV",
                JsonNodeFactory.instance.objectNode().put("malicious", true));

        ObjectNode json = writer.toJson(sampleResult(report));

        Assertions.assertEquals("COMPLETED", json.path("overallStatus").asText());
        Assertions.assertEquals(2, json.path("routingRecords").size());
        Assertions.assertEquals("condition not met", json.path("routingRecords").get(1).path("detail").asText());
        Assertions.assertTrue(json.path("sinkResults").path("alert").path("reports").get(0)
                .path("report").path("malicious").asBoolean());
        Assertions.assertEquals("branch not executed (conditional path not taken)",
                json.path("sinkResults").path("archive").path("reason").asText());
    }

    @Test
    public void testOutputDoesNotShareReportPayload() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("malicious", true);
        ExecutionReport report = ExecutionReport.success("ClamAV", payload);

        ObjectNode json = writer.toJson(sampleResult(report));
        ((ObjectNode) json.path("sinkResults").path("alert").path("reports").get(0).path("report"))
                .put("malicious", false);

        Assertions.assertTrue(report.getPayload().path("malicious").asBoolean(), "修改输出不应影响原始报告");
    }
}
