package cn.hjw.dev.threatflow.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 分支条件类型
 * wireName 与编辑器 JSON 中的 conditionType 保持一致
 */
@Getter
@RequiredArgsConstructor
public enum ConditionKind {

    VERDICT_MALICIOUS("verdict_malicious", null),
    VERDICT_SUSPICIOUS("verdict_suspicious", null),
    VERDICT_CLEAN("verdict_clean", null),
    ANALYZER_SUCCESS("analyzer_success", null),
    ANALYZER_FAILED("analyzer_failed", null),
    FIELD_EQUALS("field_equals", ComparisonOperator.EQUALS),
    FIELD_CONTAINS("field_contains", ComparisonOperator.CONTAINS),
    FIELD_GREATER_THAN("field_greater_than", ComparisonOperator.GREATER_THAN),
    FIELD_LESS_THAN("field_less_than", ComparisonOperator.LESS_THAN),
    YARA_RULE_MATCH("yara_rule_match", null),
    CAPABILITY_DETECTED("capability_detected", null),
    HAS_DETECTIONS("has_detections", null),
    HAS_ERRORS("has_errors", null),
    CUSTOM_FIELD("custom_field", ComparisonOperator.EQUALS);

    private final String wireName;

    // 字段类条件隐含的运算符, 非字段类为 null
    private final ComparisonOperator impliedOperator;

    /**
     * 是否直接基于报告状态 (而非 payload) 判断
     */
    public boolean isStatusBased() {
        return this == ANALYZER_SUCCESS || this == ANALYZER_FAILED;
    }

    public static ConditionKind fromWireName(String name) {
        for (ConditionKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown condition kind: " + name);
    }
}
