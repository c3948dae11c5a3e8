package com.fastdispatch.core.failure.handler;

import com.fastdispatch.core.EngineOps;
import com.fastdispatch.core.spi.failure.FailureDecider;
import com.fastdispatch.core.spi.failure.FailureDeciderHandler;
import com.fastdispatch.model.DispatchJob;
import com.fastdispatch.model.ctx.JobAttemptContext;
import lombok.extern.slf4j.Slf4j;

/**
 * 终态失败处理，不再入队
 */
@Slf4j
public class TerminalFailureDeciderHandler implements FailureDeciderHandler {
    @Override
    public FailureDecider.Outcome support() {
        return FailureDecider.Outcome.FAILED;
    }

    @Override
    public boolean handle(DispatchJob job, JobAttemptContext ctx, FailureDecider.Decision d, EngineOps ops) {
        ops.meter().incFailed();
        log.warn("[Retry] job={} terminally failed after {} attempt(s), code={}, msg={}",
                job.getExtId(), job.getAttempt() + 1, d.getCode(), d.getMessage());
        return false;
    }
}
