package com.fastdispatch.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * 每次尝试一行
 */
@TableName("jobs")
@Data
public class JobAttemptEntity {

    @TableId(value = "job_id", type = IdType.AUTO)
    private Long jobId;

    private Long runId;

    private Integer extId;

    private Integer priority;

    private Integer attempt;

    /** PENDING/RUNNING/SUCCESS/FAILED */
    private String status;

    private String failReason;

    private Long enqueueTs;

    private Long startTs;

    private Long endTs;

    private Long waitMs;

    private Long serviceMs;

    private Long turnaroundMs;

    private Long backoffMs;

    /** 1=任务在本次尝试后退出调度 */
    private Integer terminal;
}
