package cn.hjw.dev.threatflow.model;

/**
 * 节点类型
 */
public enum NodeKind {

    // 样本来源, 每个图有且仅有一个
    SOURCE,

    // 分析任务 (对应外部服务中的一个分析器)
    TASK,

    // 条件分支, 恰好两条出边: true-branch / false-branch
    BRANCH,

    // 结果汇聚节点
    SINK
}
