package cn.hjw.dev.threatflow.json;

import cn.hjw.dev.threatflow.exception.WorkflowRuntimeException;
import cn.hjw.dev.threatflow.model.BranchLabel;
import cn.hjw.dev.threatflow.model.ComparisonOperator;
import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import cn.hjw.dev.threatflow.model.ConditionKind;
import cn.hjw.dev.threatflow.model.NodeKind;
import cn.hjw.dev.threatflow.model.WorkflowGraph;
import cn.hjw.dev.threatflow.model.WorkflowNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * 把编辑器导出的工作流 JSON 转换为 {@link WorkflowGraph}
 * <pre>
 * {
 *   "nodes": [{"id": "n1", "type": "file|analyzer|conditional|result", "data": {...}}],
 *   "edges": [{"source": "n1", "target": "n2", "sourceHandle": "true-output"}]
 * }
 * </pre>
 * 只做格式转换, 结构合法性交给 GraphValidator。
 */
@Slf4j
public class WorkflowJsonReader {

    private static final String DEFAULT_CONDITION_KIND = ConditionKind.VERDICT_MALICIOUS.getWireName();

    private final ObjectMapper objectMapper;

    public WorkflowJsonReader() {
        this(new ObjectMapper());
    }

    public WorkflowJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WorkflowGraph read(String json) {
        try {
            return read(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new WorkflowRuntimeException("Malformed workflow JSON: " + e.getOriginalMessage(), e);
        }
    }

    public WorkflowGraph read(InputStream in) {
        try {
            return read(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new WorkflowRuntimeException("Failed to read workflow JSON", e);
        }
    }

    public WorkflowGraph read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new WorkflowRuntimeException("Workflow JSON must be an object with nodes and edges");
        }
        WorkflowGraph.Builder builder = WorkflowGraph.builder();
        Map<String, NodeKind> kinds = new HashMap<>();

        // Builder 对重复 id / 未知端点抛 IllegalArgumentException, 统一转换
        try {
            for (JsonNode nodeJson : root.path("nodes")) {
                WorkflowNode node = toNode(nodeJson);
                builder.addNode(node);
                kinds.put(node.getId(), node.getKind());
            }

            for (JsonNode edgeJson : root.path("edges")) {
                String source = requiredText(edgeJson, "source");
                String target = requiredText(edgeJson, "target");
                BranchLabel label = kinds.get(source) == NodeKind.BRANCH ? toLabel(edgeJson.path("sourceHandle").asText(null)) : null;
                if (label != null) {
                    builder.addBranchRoute(source, label, target);
                } else {
                    builder.addRoute(source, target);
                }
            }

            WorkflowGraph graph = builder.build();
            log.debug("Parsed workflow with {} nodes", graph.getNodes().size());
            return graph;
        } catch (IllegalArgumentException e) {
            throw new WorkflowRuntimeException("Invalid workflow JSON: " + e.getMessage(), e);
        }
    }

    private WorkflowNode toNode(JsonNode nodeJson) {
        String id = requiredText(nodeJson, "id");
        String type = nodeJson.path("type").asText("");
        JsonNode data = nodeJson.path("data");

        switch (type) {
            case "file":
                return WorkflowNode.source(id);
            case "analyzer":
                String taskName = data.path("analyzer").asText(null);
                if (taskName == null || taskName.isBlank()) {
                    throw new WorkflowRuntimeException("Analyzer node " + id + " has no analyzer name");
                }
                return WorkflowNode.task(id, taskName);
            case "conditional":
                return WorkflowNode.branch(id, toCondition(id, data));
            case "result":
                return WorkflowNode.sink(id);
            default:
                throw new WorkflowRuntimeException("Unsupported node type '" + type + "' on node " + id);
        }
    }

    // 条件字段既可以平铺在 data 上, 也可以放在 data.condition 里
    private ConditionDescriptor toCondition(String nodeId, JsonNode data) {
        JsonNode source = data.path("condition").isObject() ? data.path("condition") : data;

        String kindName = firstText(source, "conditionType", "type");
        try {
            ConditionKind kind = ConditionKind.fromWireName(kindName != null ? kindName : DEFAULT_CONDITION_KIND);
            String operator = firstText(source, "operator");
            JsonNode expected = source.get("expectedValue");
            return ConditionDescriptor.builder()
                    .kind(kind)
                    .sourceTask(firstText(source, "sourceAnalyzer", "sourceTask"))
                    .fieldPath(firstText(source, "fieldPath"))
                    .expectedValue(expected == null || expected.isNull() ? null : expected)
                    .operator(operator != null ? ComparisonOperator.fromWireName(operator) : null)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowRuntimeException("Invalid condition on node " + nodeId + ": " + e.getMessage(), e);
        }
    }

    private BranchLabel toLabel(String handle) {
        if (handle == null) {
            return null;
        }
        switch (handle) {
            case "true-output":
            case "true-branch":
                return BranchLabel.TRUE_BRANCH;
            case "false-output":
            case "false-branch":
                return BranchLabel.FALSE_BRANCH;
            default:
                return null;
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String requiredText(JsonNode node, String field) {
        String value = firstText(node, field);
        if (value == null) {
            throw new WorkflowRuntimeException("Missing required field '" + field + "' in " + node);
        }
        return value;
    }
}
