package com.fastdispatch.core.sink;

import com.fastdispatch.core.spi.MetricsSink;
import com.fastdispatch.mapper.DispatchRunMapper;
import com.fastdispatch.mapper.JobAttemptMapper;
import com.fastdispatch.model.JobAttemptRecord;
import com.fastdispatch.model.RunSummary;
import com.fastdispatch.model.entity.DispatchRunEntity;
import com.fastdispatch.model.entity.JobAttemptEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;

/**
 * runs / jobs 两张表落库
 * 运行开始先插入 runs 行拿到 run_id，每次尝试带 run_id 插入 jobs，结束回写汇总
 */
public class MybatisMetricsSink implements MetricsSink, InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(MybatisMetricsSink.class);

    private final DispatchRunMapper runMapper;

    private final JobAttemptMapper jobMapper;

    /** 当前运行，单线程调度下只有一个 */
    private volatile Long currentRunId;

    public MybatisMetricsSink(DispatchRunMapper runMapper, JobAttemptMapper jobMapper) {
        this.runMapper = runMapper;
        this.jobMapper = jobMapper;
    }

    @Override
    public String name() {
        return "db";
    }

    @Override
    public void afterPropertiesSet() {
        runMapper.createTableIfAbsent();
        jobMapper.createTableIfAbsent();
        log.info("[Sink-db] schema ready");
    }

    @Override
    public void beginRun(long startedAt) {
        DispatchRunEntity run = new DispatchRunEntity();
        run.setStartedAt(startedAt);
        runMapper.insert(run);
        currentRunId = run.getRunId();
        log.info("[Sink-db] run_id={} opened", currentRunId);
    }

    @Override
    public void recordAttempt(JobAttemptRecord r) {
        JobAttemptEntity e = new JobAttemptEntity();
        e.setRunId(currentRunId);
        e.setExtId(r.getExtId());
        e.setPriority(r.getPriority());
        e.setAttempt(r.getAttempt());
        e.setStatus(r.getState().name());
        e.setFailReason(r.getFailReason() == null ? "" : r.getFailReason());
        e.setEnqueueTs(r.getEnqueueTs());
        e.setStartTs(r.getStartTs());
        e.setEndTs(r.getEndTs());
        e.setWaitMs(r.getWaitMs());
        e.setServiceMs(r.getServiceMs());
        e.setTurnaroundMs(r.getTurnaroundMs());
        e.setBackoffMs(r.getBackoffMs());
        e.setTerminal(r.isTerminal() ? 1 : 0);
        jobMapper.insert(e);
    }

    @Override
    public void recordRunSummary(RunSummary s) {
        DispatchRunEntity run = new DispatchRunEntity();
        run.setRunId(currentRunId);
        run.setStartedAt(s.getStartedAt());
        run.setFinishedAt(s.getFinishedAt());
        run.setTotalJobs(s.getTotalJobs());
        run.setSuccessJobs(s.getSuccessCount());
        run.setFailedJobs(s.getFailedCount());
        run.setAvgWaitMs(s.getAvgWaitMs());
        run.setAvgServiceMs(s.getAvgServiceMs());
        run.setAvgTurnaroundMs(s.getAvgTurnaroundMs());
        run.setThroughputJobsPerS(s.getThroughputJobsPerSecond());
        // beginRun 失败时没有 run 行，直接插入完整汇总
        if (currentRunId == null || runMapper.finishRun(run) == 0) {
            run.setRunId(null);
            runMapper.insert(run);
        }
        log.info("[Sink-db] run_id={} summary stored", run.getRunId());
        currentRunId = null;
    }

    public Long getCurrentRunId() {
        return currentRunId;
    }
}
