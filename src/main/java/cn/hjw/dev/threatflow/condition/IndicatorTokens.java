package cn.hjw.dev.threatflow.condition;

import cn.hjw.dev.threatflow.model.ConditionKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 文本兜底匹配的关键词表
 */
final class IndicatorTokens {

    private static final Map<ConditionKind, List<String>> TOKENS = new EnumMap<>(ConditionKind.class);

    // 这些关键词前面出现 "no " 时不算命中, 如 "no detections"
    private static final Map<ConditionKind, Boolean> NEGATION_GUARD = new EnumMap<>(ConditionKind.class);

    static {
        TOKENS.put(ConditionKind.VERDICT_MALICIOUS, List.of(
                "malicious", "malware", "virus", "trojan", "ransomware",
                "suspicious", "threat", "infected", "exploit", "backdoor"));
        TOKENS.put(ConditionKind.VERDICT_SUSPICIOUS, List.of("suspicious"));
        TOKENS.put(ConditionKind.HAS_DETECTIONS, List.of("detection", "alert", "match", "finding", "signature"));
        TOKENS.put(ConditionKind.YARA_RULE_MATCH, List.of("match", "rule"));
        NEGATION_GUARD.put(ConditionKind.HAS_DETECTIONS, true);
    }

    private IndicatorTokens() {
    }

    static boolean supports(ConditionKind kind) {
        return TOKENS.containsKey(kind);
    }

    /**
     * @return 命中的关键词
     */
    static Optional<String> findMatch(ConditionKind kind, String text) {
        String haystack = text.toLowerCase(Locale.ROOT);
        boolean guarded = NEGATION_GUARD.getOrDefault(kind, false);
        for (String token : TOKENS.getOrDefault(kind, List.of())) {
            if (haystack.contains(token) && !(guarded && haystack.contains("no " + token))) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
