package cn.hjw.dev.threatflow.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * 分析服务调用治理:
 * 1. 轮询间隔与单批次超时
 * 2. 提交 / 轮询失败的重试与退避
 */
@Getter
@Builder
public class PollingGovernance {

    // --- 轮询配置 ---
    @Builder.Default
    private Duration pollInterval = Duration.ofSeconds(5);

    @Builder.Default
    private Duration analysisTimeout = Duration.ofSeconds(300);

    // --- 重试配置 ---
    @Builder.Default
    private int maxRetries = 0; // 最大重试次数

    @Builder.Default
    private Duration retryBackoff = Duration.ZERO; // 每次重试的退避时间

    public static PollingGovernance defaults() {
        return PollingGovernance.builder().build();
    }
}
