package cn.hjw.dev.threatflow.engine;

public interface ExecutableWorkflow {

    /**
     * 对一个样本执行工作流
     * @param artifact 待分析的样本内容
     * @return 运行结果 (各 Sink 的报告或未执行原因)
     */
    WorkflowRunResult apply(byte[] artifact);
}
