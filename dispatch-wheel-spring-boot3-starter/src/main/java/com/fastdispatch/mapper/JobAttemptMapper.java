package com.fastdispatch.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastdispatch.model.entity.JobAttemptEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface JobAttemptMapper extends BaseMapper<JobAttemptEntity> {

    @Update("""
        CREATE TABLE IF NOT EXISTS jobs(
          job_id INTEGER PRIMARY KEY AUTOINCREMENT,
          run_id BIGINT,
          ext_id INTEGER,
          priority INTEGER,
          attempt INTEGER,
          status TEXT,
          fail_reason TEXT,
          enqueue_ts BIGINT,
          start_ts BIGINT,
          end_ts BIGINT,
          wait_ms BIGINT,
          service_ms BIGINT,
          turnaround_ms BIGINT,
          backoff_ms BIGINT,
          terminal INTEGER
        )
    """)
    void createTableIfAbsent();

    /**
     * 某次运行的全部尝试，按执行顺序
     */
    @Select("""
        select * from jobs
        where run_id = #{runId}
        order by start_ts asc, attempt asc
    """)
    List<JobAttemptEntity> selectByRun(@Param("runId") long runId);

    /**
     * 某次运行中各任务的最终状态数量
     */
    @Select("""
        select count(*) from jobs
        where run_id = #{runId} and terminal = 1 and status = #{status}
    """)
    int countTerminal(@Param("runId") long runId, @Param("status") String status);
}
