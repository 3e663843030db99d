package cn.hjw.dev.threatflow.client;

import java.util.List;

/**
 * 外部多引擎分析服务 (只消费其提交 / 轮询契约, 不在本项目中实现)
 */
public interface AnalysisClient {

    /**
     * 提交一个批次
     * @param taskNames 要运行的任务名, 不能为空
     * @param artifact  被分析的样本
     * @return 作业 ID
     * @throws cn.hjw.dev.threatflow.exception.NoTasksException 任务列表为空
     * @throws cn.hjw.dev.threatflow.exception.AnalysisClientException 服务调用失败
     */
    String submit(List<String> taskNames, byte[] artifact);

    /**
     * 查询作业状态, 调用方负责轮询直到状态离开 RUNNING
     * @param jobId 作业 ID
     * @return 当前状态与已产生的报告
     */
    JobStatus poll(String jobId);
}
