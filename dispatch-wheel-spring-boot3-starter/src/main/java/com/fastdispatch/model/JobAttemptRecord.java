package com.fastdispatch.model;

import com.fastdispatch.model.enums.JobState;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次尝试的快照，交给 MetricsSink / DispatchListener
 */
@Getter
@Builder
@ToString
public class JobAttemptRecord {

    private final int extId;
    private final int priority;
    private final int attempt;
    private final int maxRetries;
    private final JobState state;
    private final String failReason;
    private final long enqueueTs;
    private final long startTs;
    private final long endTs;
    private final long waitMs;
    private final long serviceMs;
    private final long turnaroundMs;
    /** 本次尝试开始前实际等待的退避时长 */
    private final long backoffMs;
    /** 本次尝试之后任务不再调度（成功或重试耗尽） */
    private final boolean terminal;

    public static JobAttemptRecord of(DispatchJob job, boolean terminal) {
        return JobAttemptRecord.builder()
                .extId(job.getExtId())
                .priority(job.getPriority())
                .attempt(job.getAttempt())
                .maxRetries(job.getMaxRetries())
                .state(job.getState())
                .failReason(job.getFailReason())
                .enqueueTs(job.getEnqueueTs())
                .startTs(job.getStartTs() == null ? 0L : job.getStartTs())
                .endTs(job.getEndTs() == null ? 0L : job.getEndTs())
                .waitMs(job.getWaitMs())
                .serviceMs(job.getServiceMs())
                .turnaroundMs(job.getTurnaroundMs())
                .backoffMs(job.getBackoffMs())
                .terminal(terminal)
                .build();
    }

    /** 重试耗尽的终态失败，与成功区分 */
    public boolean isRetryExhausted() {
        return terminal && state == JobState.FAILED;
    }
}
