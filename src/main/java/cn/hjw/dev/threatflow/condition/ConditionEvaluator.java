package cn.hjw.dev.threatflow.condition;

import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import cn.hjw.dev.threatflow.model.ConditionKind;
import cn.hjw.dev.threatflow.model.ComparisonOperator;
import cn.hjw.dev.threatflow.report.ExecutionReport;
import cn.hjw.dev.threatflow.report.ReportStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 分支条件求值 (纯查询, 不修改传入的报告列表)
 * <p>
 * 分层判定, 第一个适用的层给出结果:
 * 1. 直接字段: 规范字段存在且类型匹配
 * 2. 字段路径: 显式 fieldPath 或已知分析器的指标路径
 * 3. 文本兜底: 报告序列化后匹配关键词
 * 4. 安全默认: false
 * <p>
 * 最后再根据 negate 取反。无法判定的条件从不抛异常。
 */
@Slf4j
public class ConditionEvaluator {

    private final AnalyzerSchema schema;

    public ConditionEvaluator() {
        this(AnalyzerSchema.defaults());
    }

    public ConditionEvaluator(AnalyzerSchema schema) {
        this.schema = schema;
    }

    public boolean evaluate(ConditionDescriptor condition, List<ExecutionReport> reportsSoFar) {
        return explain(condition, reportsSoFar).isResult();
    }

    public EvaluationOutcome explain(ConditionDescriptor condition, List<ExecutionReport> reportsSoFar) {
        Objects.requireNonNull(condition, "condition");
        Decision decision = decide(condition, reportsSoFar);
        boolean result = condition.isNegate() != decision.value;

        if (decision.tier == EvaluationTier.SAFE_DEFAULT) {
            log.warn("Condition {} fell back to safe default: {}", condition.describe(), decision.detail);
        } else {
            log.debug("Condition {} decided by {}: {} ({})", condition.describe(), decision.tier, decision.value, decision.detail);
        }
        return new EvaluationOutcome(result, decision.value, decision.tier, decision.detail);
    }

    private Decision decide(ConditionDescriptor condition, List<ExecutionReport> reports) {
        ConditionKind kind = condition.getKind();
        if (kind == null) {
            return Decision.safeDefault("condition has no kind");
        }
        if (!condition.hasSourceTask()) {
            return Decision.safeDefault("condition has no source task");
        }
        ExecutionReport report = findReport(condition.getSourceTask(), reports).orElse(null);
        if (report == null) {
            return Decision.safeDefault("task " + condition.getSourceTask() + " has no report");
        }

        // 状态类条件直接看报告状态
        if (kind.isStatusBased()) {
            boolean succeeded = report.getStatus() == ReportStatus.SUCCESS;
            boolean value = kind == ConditionKind.ANALYZER_SUCCESS ? succeeded : !succeeded;
            return new Decision(value, EvaluationTier.DIRECT_FIELD, "report status " + report.getStatus());
        }
        if (!report.isSuccess()) {
            return Decision.safeDefault("task " + condition.getSourceTask() + " failed: " + report.getErrors());
        }

        JsonNode payload = report.getPayload();

        // 1. 直接字段
        for (DirectFieldRule rule : DirectFieldRules.forKind(kind)) {
            Optional<Boolean> value = rule.apply(payload, condition);
            if (value.isPresent()) {
                return new Decision(value.get(), EvaluationTier.DIRECT_FIELD, "canonical field for " + kind.getWireName());
            }
        }

        // 2. 字段路径
        Optional<Decision> byPath = condition.hasFieldPath()
                ? evaluateFieldPath(condition, payload)
                : evaluateSchemaIndicators(kind, report.getTaskName(), payload);
        if (byPath.isPresent()) {
            return byPath.get();
        }

        // 3. 文本兜底
        if (IndicatorTokens.supports(kind)) {
            Optional<String> token = IndicatorTokens.findMatch(kind, payload.toString());
            return new Decision(token.isPresent(), EvaluationTier.GENERIC_TOKENS,
                    token.map(t -> "found token '" + t + "'").orElse("no indicator token found"));
        }

        // 4. 安全默认
        return Decision.safeDefault("no evaluation tier applies to " + kind.getWireName());
    }

    private Optional<Decision> evaluateFieldPath(ConditionDescriptor condition, JsonNode payload) {
        FieldPath path;
        try {
            path = FieldPath.parse(condition.getFieldPath());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid field path '{}': {}", condition.getFieldPath(), e.getMessage());
            return Optional.empty();
        }
        Optional<JsonNode> actual = path.resolve(payload);
        if (actual.isEmpty()) {
            log.debug("Field path '{}' not found in report of {}", path, condition.getSourceTask());
            return Optional.empty();
        }
        ComparisonOperator operator = condition.effectiveOperator();
        return ValueComparator.compare(actual.get(), operator, condition.getExpectedValue())
                .map(value -> new Decision(value, EvaluationTier.FIELD_PATH,
                        path + " " + operator.getWireName() + " " + condition.getExpectedValue()));
    }

    private Optional<Decision> evaluateSchemaIndicators(ConditionKind kind, String taskName, JsonNode payload) {
        if (kind != ConditionKind.VERDICT_MALICIOUS && kind != ConditionKind.HAS_DETECTIONS) {
            return Optional.empty();
        }
        boolean anyResolved = false;
        for (IndicatorRule rule : schema.indicatorsFor(taskName)) {
            Optional<JsonNode> value = rule.getPath().resolve(payload);
            if (value.isPresent()) {
                anyResolved = true;
                if (rule.getIndicates().test(value.get())) {
                    return Optional.of(new Decision(true, EvaluationTier.FIELD_PATH,
                            "schema indicator " + rule.getPath() + " of " + taskName));
                }
            }
        }
        if (anyResolved) {
            return Optional.of(new Decision(false, EvaluationTier.FIELD_PATH,
                    "no schema indicator of " + taskName + " is set"));
        }
        return Optional.empty();
    }

    // 同一任务有多份报告时取最后一份
    private Optional<ExecutionReport> findReport(String taskName, List<ExecutionReport> reports) {
        ExecutionReport found = null;
        for (ExecutionReport report : reports) {
            if (taskName.equals(report.getTaskName())) {
                found = report;
            }
        }
        return Optional.ofNullable(found);
    }

    private static class Decision {
        private final boolean value;
        private final EvaluationTier tier;
        private final String detail;

        Decision(boolean value, EvaluationTier tier, String detail) {
            this.value = value;
            this.tier = tier;
            this.detail = detail;
        }

        static Decision safeDefault(String detail) {
            return new Decision(false, EvaluationTier.SAFE_DEFAULT, detail);
        }
    }
}
