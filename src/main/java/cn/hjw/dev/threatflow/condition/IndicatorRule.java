package cn.hjw.dev.threatflow.condition;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.Set;
import java.util.function.Predicate;

/**
 * 已知分析器的恶意指标: 字段路径 + 判定
 */
@Getter
public class IndicatorRule {

    private final FieldPath path;
    private final Predicate<JsonNode> indicates;

    private IndicatorRule(String path, Predicate<JsonNode> indicates) {
        this.path = FieldPath.parse(path);
        this.indicates = indicates;
    }

    /**
     * 数组 / 对象非空, 布尔为 true, 文本非空
     */
    public static IndicatorRule nonEmpty(String path) {
        return new IndicatorRule(path, v -> {
            if (v.isContainerNode()) {
                return v.size() > 0;
            }
            if (v.isBoolean()) {
                return v.booleanValue();
            }
            return v.isTextual() && !v.textValue().isBlank();
        });
    }

    public static IndicatorRule textIn(String path, String... values) {
        Set<String> accepted = Set.of(values);
        return new IndicatorRule(path, v -> v.isTextual() && accepted.contains(v.textValue()));
    }

    public static IndicatorRule numberAbove(String path, double threshold) {
        return new IndicatorRule(path, v -> {
            Double d = ValueComparator.toDouble(v);
            return d != null && d > threshold;
        });
    }
}
