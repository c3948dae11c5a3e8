package com.fastdispatch.core.spi;

import com.fastdispatch.model.JobAttemptRecord;
import com.fastdispatch.model.RunSummary;

/**
 * 运行指标的持久化出口
 * 实现抛出的异常由引擎记录日志，不会中断调度
 */
public interface MetricsSink {

    /** 名称，用于日志 */
    String name();

    /** 运行开始，首个尝试记录之前调用一次 */
    default void beginRun(long startedAt) {
    }

    /** 每次尝试结束（时间戳已确定、下一次调度之前）调用一次 */
    void recordAttempt(JobAttemptRecord record);

    /** 队列排空后调用一次 */
    void recordRunSummary(RunSummary summary);
}
