package cn.hjw.dev.threatflow.condition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static cn.hjw.dev.threatflow.condition.IndicatorRule.nonEmpty;
import static cn.hjw.dev.threatflow.condition.IndicatorRule.numberAbove;
import static cn.hjw.dev.threatflow.condition.IndicatorRule.textIn;

/**
 * 已知分析器报告中的恶意指标路径
 * <p>
 * 条件没有 fieldPath 时, 用这些路径做结构化查找, 再不行才退到文本匹配。
 */
public class AnalyzerSchema {

    private final Map<String, List<IndicatorRule>> indicators;

    private AnalyzerSchema(Map<String, List<IndicatorRule>> indicators) {
        this.indicators = Collections.unmodifiableMap(new LinkedHashMap<>(indicators));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnalyzerSchema empty() {
        return builder().build();
    }

    /**
     * 根据真实分析器返回整理的默认指标
     */
    public static AnalyzerSchema defaults() {
        return builder()
                .register("ClamAV", nonEmpty("detections"))
                .register("Yara",
                        nonEmpty("yara-rules_rules"),
                        nonEmpty("elastic_protections-artifacts"),
                        nonEmpty("advanced-threat-research_yara-rules"),
                        nonEmpty("neo23x0_signature-base"))
                .register("Doc_Info", textIn("mraptor", "suspicious"))
                .register("Quark_Engine",
                        textIn("threat_level", "High Risk", "Critical", "Malicious"),
                        numberAbove("total_score", 50),
                        nonEmpty("crimes"))
                .register("APK_Artifacts", nonEmpty("permission"))
                .register("APKiD", nonEmpty("files"))
                .register("Rtf_Info", nonEmpty("rtfobj.ole_objects"), nonEmpty("follina"))
                .register("BoxJS", nonEmpty("IOC.json"))
                // 仅元数据, 不做恶意判定
                .register("File_Info")
                .build();
    }

    public List<IndicatorRule> indicatorsFor(String taskName) {
        return indicators.getOrDefault(taskName, List.of());
    }

    public boolean isKnown(String taskName) {
        return indicators.containsKey(taskName);
    }

    public static class Builder {

        private final Map<String, List<IndicatorRule>> indicators = new LinkedHashMap<>();

        public Builder register(String taskName, IndicatorRule... rules) {
            indicators.put(taskName, List.of(rules));
            return this;
        }

        public AnalyzerSchema build() {
            return new AnalyzerSchema(indicators);
        }
    }
}
