package cn.hjw.dev.threatflow.condition;

import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import cn.hjw.dev.threatflow.model.ConditionKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static cn.hjw.dev.threatflow.condition.DirectFieldRule.anyNonEmptyArray;
import static cn.hjw.dev.threatflow.condition.DirectFieldRule.bool;
import static cn.hjw.dev.threatflow.condition.DirectFieldRule.textContainsAny;
import static cn.hjw.dev.threatflow.condition.DirectFieldRule.typed;

/**
 * 每种条件的规范字段, 按优先级排列
 */
final class DirectFieldRules {

    private static final Map<ConditionKind, List<DirectFieldRule>> RULES = new EnumMap<>(ConditionKind.class);

    static {
        RULES.put(ConditionKind.VERDICT_MALICIOUS, List.of(
                bool("malicious", false),
                textContainsAny("verdict", "malicious", "malware", "infected"),
                anyNonEmptyArray("detections")));
        RULES.put(ConditionKind.VERDICT_SUSPICIOUS, List.of(
                bool("suspicious", false),
                textContainsAny("verdict", "suspicious")));
        RULES.put(ConditionKind.VERDICT_CLEAN, List.of(
                bool("malicious", true),
                textContainsAny("verdict", "clean", "safe", "benign")));
        RULES.put(ConditionKind.YARA_RULE_MATCH, List.of(
                anyNonEmptyArray("matches")));
        RULES.put(ConditionKind.CAPABILITY_DETECTED, List.of(
                typed("capabilities", JsonNodeType.ARRAY, DirectFieldRules::containsExpected)));
        RULES.put(ConditionKind.HAS_DETECTIONS, List.of(
                anyNonEmptyArray("detections", "signatures", "rules", "alerts", "threats")));
        RULES.put(ConditionKind.HAS_ERRORS, List.of(
                anyNonEmptyArray("errors")));
    }

    private DirectFieldRules() {
    }

    static List<DirectFieldRule> forKind(ConditionKind kind) {
        return RULES.getOrDefault(kind, List.of());
    }

    private static boolean containsExpected(JsonNode capabilities, ConditionDescriptor condition) {
        JsonNode expected = condition.getExpectedValue();
        if (expected == null || expected.isNull()) {
            return false;
        }
        for (JsonNode item : capabilities) {
            if (ValueComparator.valueEquals(item, expected)) {
                return true;
            }
        }
        return false;
    }
}
