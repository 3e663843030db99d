package cn.hjw.dev.threatflow.condition;

import cn.hjw.dev.threatflow.model.ConditionDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.util.Locale;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * 直接字段规则: 字段存在且运行时类型匹配时给出结果, 否则不适用 (empty)
 * <p>
 * 布尔字段绝不能走文本匹配, {"malicious": false} 序列化后同样包含 "malicious"。
 */
@FunctionalInterface
public interface DirectFieldRule {

    Optional<Boolean> apply(JsonNode payload, ConditionDescriptor condition);

    /**
     * 字段为指定类型时, 用 predicate 给出结果
     */
    static DirectFieldRule typed(String field, JsonNodeType type, BiPredicate<JsonNode, ConditionDescriptor> predicate) {
        return (payload, condition) -> {
            JsonNode value = payload.get(field);
            if (value == null || value.getNodeType() != type) {
                return Optional.empty();
            }
            return Optional.of(predicate.test(value, condition));
        };
    }

    static DirectFieldRule bool(String field, boolean invert) {
        return typed(field, JsonNodeType.BOOLEAN, (v, c) -> v.booleanValue() != invert);
    }

    /**
     * 文本字段 (忽略大小写) 包含任一关键词
     */
    static DirectFieldRule textContainsAny(String field, String... terms) {
        return typed(field, JsonNodeType.STRING, (v, c) -> {
            String text = v.textValue().toLowerCase(Locale.ROOT);
            if (text.isBlank()) {
                return false;
            }
            for (String term : terms) {
                if (text.contains(term)) {
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * 一组数组字段: 只要有一个存在即适用, 任一非空为 true
     */
    static DirectFieldRule anyNonEmptyArray(String... fields) {
        return (payload, condition) -> {
            boolean present = false;
            for (String field : fields) {
                JsonNode value = payload.get(field);
                if (value != null && value.isArray()) {
                    present = true;
                    if (value.size() > 0) {
                        return Optional.of(true);
                    }
                }
            }
            return present ? Optional.of(false) : Optional.empty();
        };
    }
}
