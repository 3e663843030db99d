package cn.hjw.dev.threatflow.condition;

/**
 * 条件判定所使用的层级, 前一层不适用时才进入下一层
 */
public enum EvaluationTier {

    // 规范字段 + 类型匹配, 直接取值
    DIRECT_FIELD,

    // 字段路径 (显式 fieldPath 或已知分析器的指标路径)
    FIELD_PATH,

    // 报告序列化为文本后匹配指标关键词
    GENERIC_TOKENS,

    // 无法判定, 返回 false
    SAFE_DEFAULT
}
