package com.fastdispatch.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次运行的汇总，平均值只统计成功的任务
 */
@Getter
@Builder
@ToString
public class RunSummary {

    private final long startedAt;
    private final long finishedAt;
    private final long elapsedMs;
    private final int totalJobs;
    private final int successCount;
    /** 重试耗尽的终态失败数 */
    private final int failedCount;
    private final int totalAttempts;
    private final int retryCount;
    private final double avgWaitMs;
    private final double avgServiceMs;
    private final double avgTurnaroundMs;
    private final double throughputJobsPerSecond;
}
