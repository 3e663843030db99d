package cn.hjw.dev.threatflow.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 字段比较运算符
 */
@Getter
@RequiredArgsConstructor
public enum ComparisonOperator {

    EQUALS("equals"),
    CONTAINS("contains"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan");

    private final String wireName;

    public static ComparisonOperator fromWireName(String name) {
        for (ComparisonOperator op : values()) {
            if (op.wireName.equalsIgnoreCase(name) || op.name().equalsIgnoreCase(name)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + name);
    }
}
