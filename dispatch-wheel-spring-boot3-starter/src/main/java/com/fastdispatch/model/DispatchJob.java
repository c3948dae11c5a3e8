package com.fastdispatch.model;

import com.fastdispatch.model.enums.JobState;
import lombok.Data;

/**
 * 调度中的任务，跨越所有尝试
 */
@Data
public class DispatchJob {

    /** 外部编号 */
    private int extId;

    /** 越大越优先，失败重试会提权 */
    private int priority;

    /** 当前尝试序号，从 0 开始 */
    private int attempt;

    /** 最大重试次数 */
    private int maxRetries;

    /** 本次入队时间（ms），重试入队时重置 */
    private long enqueueTs;

    /** 首次入队时间（ms），不随重试变化 */
    private long firstEnqueueTs;

    private Long startTs;

    private Long endTs;

    /** 下次执行前需等待的退避时长 */
    private long backoffMs;

    private long waitMs;

    private long serviceMs;

    private long turnaroundMs;

    private JobState state = JobState.PENDING;

    /** 仅在 FAILED 时有值 */
    private String failReason;

    public static DispatchJob admit(JobSpec spec, int priority, long enqueueTs) {
        DispatchJob job = new DispatchJob();
        job.setExtId(spec.getExtId());
        job.setMaxRetries(spec.getMaxRetries());
        job.setPriority(priority);
        job.setEnqueueTs(enqueueTs);
        job.setFirstEnqueueTs(enqueueTs);
        return job;
    }
}
