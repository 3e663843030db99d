package cn.hjw.dev.threatflow.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 分支条件描述
 * <p>
 * 取反只是一个标志位: 取反后的描述与原描述除 negate 外完全相同,
 * sourceTask 等字段不会因为取反而丢失。
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class ConditionDescriptor {

    private final ConditionKind kind;

    // 条件依赖的任务名
    private final String sourceTask;

    // 可选, 形如 "report.sections[0].entropy"
    private final String fieldPath;

    // 可选, 任意 JSON 值
    private final JsonNode expectedValue;

    // 可选, 缺省时使用 kind 隐含的运算符
    private final ComparisonOperator operator;

    private final boolean negate;

    public ConditionDescriptor negated() {
        return withNegate(true);
    }

    /**
     * 同一描述符, 只改 negate, 其余字段保持不变
     */
    public ConditionDescriptor withNegate(boolean value) {
        return negate == value ? this : toBuilder().negate(value).build();
    }

    public ConditionDescriptor withSourceTask(String taskName) {
        return toBuilder().sourceTask(taskName).build();
    }

    public boolean hasFieldPath() {
        return fieldPath != null && !fieldPath.isBlank();
    }

    public boolean hasSourceTask() {
        return sourceTask != null && !sourceTask.isBlank();
    }

    public ComparisonOperator effectiveOperator() {
        if (operator != null) {
            return operator;
        }
        if (kind != null && kind.getImpliedOperator() != null) {
            return kind.getImpliedOperator();
        }
        return ComparisonOperator.EQUALS;
    }

    public String describe() {
        String name = kind != null ? kind.getWireName() : "unknown";
        return (negate ? "NOT " : "") + name + "(" + sourceTask + ")";
    }
}
