package cn.hjw.dev.threatflow.config;

import cn.hjw.dev.threatflow.catalog.TaskCatalog;
import cn.hjw.dev.threatflow.client.AnalysisClient;
import cn.hjw.dev.threatflow.condition.ConditionEvaluator;
import lombok.Builder;
import lombok.Getter;

/**
 * 引擎配置: 分析服务客户端 + 治理 + 可选的任务目录
 */
@Getter
@Builder
public class EngineConfig {

    // 分析服务 (必填)
    private final AnalysisClient analysisClient;

    @Builder.Default
    private final PollingGovernance governance = PollingGovernance.defaults();

    // 可选, 仅用于校验阶段的提示
    private final TaskCatalog taskCatalog;

    @Builder.Default
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
}
