package cn.hjw.dev.threatflow.json;

import cn.hjw.dev.threatflow.engine.WorkflowRunResult;
import cn.hjw.dev.threatflow.exception.WorkflowRuntimeException;
import cn.hjw.dev.threatflow.executor.RoutingRecord;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import cn.hjw.dev.threatflow.route.SinkResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * 运行结果输出:
 * {overallStatus, routingRecords[], sinkResults{sinkId: {type, reports | reason}}}
 */
public class RunResultWriter {

    private final ObjectMapper objectMapper;

    public RunResultWriter() {
        this(new ObjectMapper());
    }

    public RunResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJson(WorkflowRunResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("overallStatus", result.getOverallStatus().name());

        ArrayNode records = root.putArray("routingRecords");
        for (RoutingRecord record : result.getRoutingRecords()) {
            ObjectNode node = records.addObject();
            node.put("stageId", record.getStageId());
            node.put("executed", record.isExecuted());
            node.put("state", record.getState().name());
            ArrayNode sinks = node.putArray("targetSinkIds");
            record.getTargetSinkIds().forEach(sinks::add);
            ArrayNode tasks = node.putArray("taskNames");
            record.getTaskNames().forEach(tasks::add);
            if (record.getDetail() != null) {
                node.put("detail", record.getDetail());
            }
        }

        ObjectNode sinkResults = root.putObject("sinkResults");
        for (Map.Entry<String, SinkResult> entry : result.getSinkResults().entrySet()) {
            SinkResult sinkResult = entry.getValue();
            ObjectNode node = sinkResults.putObject(entry.getKey());
            node.put("type", sinkResult.getKind().name());
            if (sinkResult.isExecuted()) {
                ArrayNode reports = node.putArray("reports");
                sinkResult.getReports().forEach(r -> reports.add(toJson(r)));
            } else {
                node.put("reason", sinkResult.getReason());
            }
        }
        return root;
    }

    public String write(WorkflowRunResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new WorkflowRuntimeException("Failed to serialize run result", e);
        }
    }

    private ObjectNode toJson(ExecutionReport report) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", report.getTaskName());
        node.put("status", report.getStatus().name());
        node.set("report", report.getPayload().deepCopy());
        ArrayNode errors = node.putArray("errors");
        report.getErrors().forEach(errors::add);
        return node;
    }
}
