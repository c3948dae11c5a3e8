package com.fastdispatch.core.failure;

import com.fastdispatch.core.spi.failure.FailureDecider;
import com.fastdispatch.model.ctx.JobAttemptContext;

/**
 * 默认所有失败都可重试，是否超过上限由引擎判断
 */
public class DefaultFailureDecider implements FailureDecider {

    @Override
    public Decision decide(JobAttemptContext ctx, Throwable error) {
        return Decision.of(Outcome.RETRY).withCode(ctx.getErr());
    }
}
