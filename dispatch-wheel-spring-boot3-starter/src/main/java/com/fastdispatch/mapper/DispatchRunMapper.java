package com.fastdispatch.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastdispatch.model.entity.DispatchRunEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface DispatchRunMapper extends BaseMapper<DispatchRunEntity> {

    @Update("""
        CREATE TABLE IF NOT EXISTS runs(
          run_id INTEGER PRIMARY KEY AUTOINCREMENT,
          started_at BIGINT,
          finished_at BIGINT,
          total_jobs INTEGER,
          success_jobs INTEGER,
          failed_jobs INTEGER,
          avg_wait_ms REAL,
          avg_service_ms REAL,
          avg_turnaround_ms REAL,
          throughput_jobs_per_s REAL
        )
    """)
    void createTableIfAbsent();

    /**
     * 运行结束回写汇总
     */
    @Update("""
        UPDATE runs
           SET finished_at = #{e.finishedAt},
               total_jobs = #{e.totalJobs},
               success_jobs = #{e.successJobs},
               failed_jobs = #{e.failedJobs},
               avg_wait_ms = #{e.avgWaitMs},
               avg_service_ms = #{e.avgServiceMs},
               avg_turnaround_ms = #{e.avgTurnaroundMs},
               throughput_jobs_per_s = #{e.throughputJobsPerS}
         WHERE run_id = #{e.runId}
    """)
    int finishRun(@Param("e") DispatchRunEntity e);
}
