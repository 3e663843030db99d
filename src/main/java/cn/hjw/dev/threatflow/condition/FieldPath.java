package cn.hjw.dev.threatflow.condition;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 字段路径表达式, 支持点号和方括号下标:
 * <pre>
 *   report.sections[0].entropy
 *   detections[2]
 *   matrix[1][0]
 * </pre>
 * 在 JsonNode (对象 / 数组 / 标量) 上解释执行, 不使用反射。
 */
@EqualsAndHashCode
public class FieldPath {

    @Getter
    private final String expression;

    private final List<Segment> segments;

    private FieldPath(String expression, List<Segment> segments) {
        this.expression = expression;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * @throws IllegalArgumentException 表达式不合法
     */
    public static FieldPath parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
        String text = expression.trim();
        List<Segment> segments = new ArrayList<>();
        int i = 0;
        StringBuilder name = new StringBuilder();
        // 刚读到 '.' 等待字段名 / 刚读到 ']'
        boolean afterDot = false;
        boolean afterBracket = false;

        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '.') {
                if (name.length() == 0 && !afterBracket) {
                    throw new IllegalArgumentException("Empty segment in field path: " + text);
                }
                flushName(name, segments, text);
                afterDot = true;
                afterBracket = false;
                i++;
            } else if (c == '[') {
                if (afterDot) {
                    throw new IllegalArgumentException("Empty segment in field path: " + text);
                }
                flushName(name, segments, text);
                int close = text.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '[' in field path: " + text);
                }
                String index = text.substring(i + 1, close).trim();
                try {
                    int value = Integer.parseInt(index);
                    if (value < 0) {
                        throw new IllegalArgumentException("Negative index in field path: " + text);
                    }
                    segments.add(Segment.index(value));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Non-integer index '" + index + "' in field path: " + text, e);
                }
                afterBracket = true;
                i = close + 1;
            } else if (c == ']') {
                throw new IllegalArgumentException("Unexpected ']' in field path: " + text);
            } else {
                if (afterBracket) {
                    throw new IllegalArgumentException("Expected '.' or '[' after ']' in field path: " + text);
                }
                name.append(c);
                afterDot = false;
                i++;
            }
        }
        if (afterDot) {
            throw new IllegalArgumentException("Trailing '.' in field path: " + text);
        }
        flushName(name, segments, text);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Field path has no segments: " + text);
        }
        return new FieldPath(text, segments);
    }

    private static void flushName(StringBuilder name, List<Segment> segments, String text) {
        if (name.length() == 0) {
            return;
        }
        String field = name.toString().trim();
        if (field.isEmpty()) {
            throw new IllegalArgumentException("Blank segment in field path: " + text);
        }
        segments.add(Segment.field(field));
        name.setLength(0);
    }

    /**
     * 沿路径导航, 任一段缺失或遇到 null 时返回 empty
     */
    public Optional<JsonNode> resolve(JsonNode root) {
        JsonNode current = root;
        for (Segment segment : segments) {
            if (current == null || current.isNull() || current.isMissingNode()) {
                return Optional.empty();
            }
            if (segment.isIndex()) {
                if (!current.isArray() || segment.index >= current.size()) {
                    return Optional.empty();
                }
                current = current.get(segment.index);
            } else if (current.isObject()) {
                current = current.get(segment.field);
            } else if (current.isArray() && isNumeric(segment.field)) {
                // 兼容 "sections.0.entropy" 写法
                int idx = Integer.parseInt(segment.field);
                current = idx < current.size() ? current.get(idx) : null;
            } else {
                return Optional.empty();
            }
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty() || s.length() > 9) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return expression;
    }

    @EqualsAndHashCode
    private static final class Segment {
        private final String field;
        private final int index;

        private Segment(String field, int index) {
            this.field = field;
            this.index = index;
        }

        static Segment field(String name) {
            return new Segment(name, -1);
        }

        static Segment index(int index) {
            return new Segment(null, index);
        }

        boolean isIndex() {
            return field == null;
        }
    }
}
