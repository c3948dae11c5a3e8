package com.fastdispatch.core.retry;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.model.DispatchJob;
import com.fastdispatch.model.enums.JobState;

/**
 * 重试策略：是否还能重试、提权幅度、重新入队时的状态重置
 * 退避时长由 BackoffRegistry 计算
 */
public class RetryPolicy {

    private final int minPriority;

    private final int maxPriority;

    private final int boost;

    public RetryPolicy(DispatchWheelProperties props) {
        this(props.getPriority().getMin(), props.getPriority().getMax(), props.getPriority().getRetryBoost());
    }

    public RetryPolicy(int minPriority, int maxPriority, int boost) {
        if (maxPriority < minPriority) {
            throw new IllegalArgumentException("dispatch.priority.max must be >= dispatch.priority.min");
        }
        if (boost < 0) {
            throw new IllegalArgumentException("dispatch.priority.retry-boost must be >= 0");
        }
        this.minPriority = minPriority;
        this.maxPriority = maxPriority;
        this.boost = boost;
    }

    /** attempt == maxRetries 时本次失败即终态 */
    public boolean canRetry(DispatchJob job) {
        return job.getAttempt() < job.getMaxRetries();
    }

    /** 失败后提权，不超过上限 */
    public int boostedPriority(int priority) {
        return clamp((long) priority + boost);
    }

    public int clamp(long priority) {
        return (int) Math.max(minPriority, Math.min(maxPriority, priority));
    }

    /**
     * 失败任务重新入队前的状态变更
     * 次数+1、提权、重置入队时间、挂上退避时长
     */
    public void prepareRetry(DispatchJob job, long now, long backoffMs) {
        job.setAttempt(job.getAttempt() + 1);
        job.setPriority(boostedPriority(job.getPriority()));
        job.setEnqueueTs(now);
        job.setBackoffMs(backoffMs);
        job.setState(JobState.PENDING);
        job.setFailReason(null);
        job.setStartTs(null);
        job.setEndTs(null);
        job.setWaitMs(0);
        job.setServiceMs(0);
        job.setTurnaroundMs(0);
    }
}
