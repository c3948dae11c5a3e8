package com.fastdispatch.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

@TableName("runs")
@Data
public class DispatchRunEntity {

    @TableId(value = "run_id", type = IdType.AUTO)
    private Long runId;

    /** 运行开始（ms） */
    private Long startedAt;

    /** 运行结束（ms），运行中为空 */
    private Long finishedAt;

    private Integer totalJobs;

    private Integer successJobs;

    private Integer failedJobs;

    private Double avgWaitMs;

    private Double avgServiceMs;

    private Double avgTurnaroundMs;

    @TableField("throughput_jobs_per_s")
    private Double throughputJobsPerS;
}
