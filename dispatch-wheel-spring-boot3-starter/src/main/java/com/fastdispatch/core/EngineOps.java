package com.fastdispatch.core;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.backoff.BackoffRegistry;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.retry.RetryPolicy;
import com.fastdispatch.core.spi.DispatchClock;
import com.fastdispatch.core.spi.JobScheduler;
import com.fastdispatch.core.spi.failure.FailureDecider;
import com.fastdispatch.model.DispatchJob;

/**
 * 只暴露失败处理器需要的能力
 * 不暴露实现细节
 */
public interface EngineOps {

    DispatchWheelProperties props();

    BackoffRegistry backoff();

    RetryPolicy retryPolicy();

    JobScheduler scheduler();

    DispatchClock clock();

    DispatchMetrics meter();

    /**
     * 计算退避时长（带 Decision 的退避倍率）
     * 倍率为 0 表示立即重试；负数倍率无效，按 1 处理
     */
    default long calcBackoffMillis(DispatchJob job, FailureDecider.Decision d) {
        long base = backoff().delayMillis(job.getAttempt(), job);
        if (d.getBackoffFactor() >= 0 && d.getBackoffFactor() != 1.0) {
            return Math.max(0, (long) (base * d.getBackoffFactor()));
        }
        return base;
    }
}
