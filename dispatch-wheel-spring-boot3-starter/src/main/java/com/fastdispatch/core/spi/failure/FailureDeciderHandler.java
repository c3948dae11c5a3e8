package com.fastdispatch.core.spi.failure;

import com.fastdispatch.core.EngineOps;
import com.fastdispatch.model.DispatchJob;
import com.fastdispatch.model.ctx.JobAttemptContext;

/**
 * 根据决策作出处理
 */
public interface FailureDeciderHandler {

    FailureDecider.Outcome support();

    /**
     * @return true=任务已重新入队；false=任务进入终态
     */
    boolean handle(DispatchJob job, JobAttemptContext ctx, FailureDecider.Decision d, EngineOps ops);
}
