package cn.hjw.dev.threatflow.condition;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public class EvaluationOutcome {

    // 取反之后的最终结果
    private final boolean result;

    // 取反之前, 由 tier 给出的结果
    private final boolean rawResult;

    private final EvaluationTier tier;

    private final String detail;
}
