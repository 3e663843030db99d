package cn.hjw.dev.threatflow.condition;

import cn.hjw.dev.threatflow.model.ComparisonOperator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Optional;

/**
 * JSON 值比较. 返回 empty 表示无法比较 (由调用方降级到下一层)
 */
final class ValueComparator {

    private ValueComparator() {
    }

    static Optional<Boolean> compare(JsonNode actual, ComparisonOperator operator, JsonNode expected) {
        if (actual == null || expected == null || expected.isNull()) {
            return Optional.empty();
        }
        switch (operator) {
            case EQUALS:
                return Optional.of(valueEquals(actual, expected));
            case CONTAINS:
                return contains(actual, expected);
            case GREATER_THAN:
                return numeric(actual, expected, true);
            case LESS_THAN:
                return numeric(actual, expected, false);
            default:
                return Optional.empty();
        }
    }

    static boolean valueEquals(JsonNode actual, JsonNode expected) {
        if (actual.isNumber() || expected.isNumber()) {
            Double a = toDouble(actual);
            Double e = toDouble(expected);
            if (a != null && e != null) {
                return Double.compare(a, e) == 0;
            }
        }
        if (actual.isBoolean() && expected.isTextual()) {
            return String.valueOf(actual.booleanValue()).equalsIgnoreCase(expected.textValue().trim());
        }
        if (actual.isValueNode() && expected.isValueNode()) {
            return actual.asText().equals(expected.asText());
        }
        return actual.equals(expected);
    }

    private static Optional<Boolean> contains(JsonNode actual, JsonNode expected) {
        String needle = expected.asText();
        if (actual.isTextual()) {
            return Optional.of(actual.textValue().contains(needle));
        }
        if (actual.isArray()) {
            for (JsonNode item : actual) {
                if (valueEquals(item, expected)) {
                    return Optional.of(true);
                }
                if (item.isValueNode() && item.asText().contains(needle)) {
                    return Optional.of(true);
                }
            }
            return Optional.of(false);
        }
        if (actual.isObject()) {
            Iterator<String> names = actual.fieldNames();
            while (names.hasNext()) {
                if (names.next().equals(needle)) {
                    return Optional.of(true);
                }
            }
            return Optional.of(false);
        }
        return Optional.empty();
    }

    private static Optional<Boolean> numeric(JsonNode actual, JsonNode expected, boolean greater) {
        Double a = toDouble(actual);
        Double e = toDouble(expected);
        if (a == null || e == null) {
            return Optional.empty();
        }
        return Optional.of(greater ? a > e : a < e);
    }

    static Double toDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
