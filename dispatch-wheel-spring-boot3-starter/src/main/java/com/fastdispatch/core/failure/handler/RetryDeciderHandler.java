package com.fastdispatch.core.failure.handler;

import com.fastdispatch.core.EngineOps;
import com.fastdispatch.core.spi.failure.FailureDecider;
import com.fastdispatch.core.spi.failure.FailureDeciderHandler;
import com.fastdispatch.model.DispatchJob;
import com.fastdispatch.model.ctx.JobAttemptContext;
import lombok.extern.slf4j.Slf4j;

/**
 * 重试决策处理
 * 计算退避、提权、重置入队时间后放回队列
 */
@Slf4j
public class RetryDeciderHandler implements FailureDeciderHandler {

    @Override
    public FailureDecider.Outcome support() {
        return FailureDecider.Outcome.RETRY;
    }

    @Override
    public boolean handle(DispatchJob job, JobAttemptContext ctx, FailureDecider.Decision d, EngineOps ops) {
        int failedAttempt = job.getAttempt();
        int priorityBefore = job.getPriority();
        long backoffMs = ops.calcBackoffMillis(job, d);

        ops.retryPolicy().prepareRetry(job, ops.clock().nowMillis(), backoffMs);
        ops.scheduler().push(job);
        ops.meter().incRetried();
        log.debug("[Retry] job={} attempt {} -> {}, priority {} -> {}, backoff={}ms",
                job.getExtId(), failedAttempt, job.getAttempt(), priorityBefore, job.getPriority(), backoffMs);
        return true;
    }
}
