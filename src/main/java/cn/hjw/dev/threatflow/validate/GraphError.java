package cn.hjw.dev.threatflow.validate;

/**
 * 图结构错误码, 按校验顺序排列
 */
public enum GraphError {
    NO_SOURCE_NODE,
    MULTIPLE_SOURCE_NODES,
    CYCLE_DETECTED,
    UNREACHABLE_NODE,
    MALFORMED_BRANCH
}
