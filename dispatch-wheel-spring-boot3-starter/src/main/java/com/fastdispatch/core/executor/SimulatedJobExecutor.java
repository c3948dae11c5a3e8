package com.fastdispatch.core.executor;

import com.fastdispatch.core.spi.DispatchClock;
import com.fastdispatch.core.spi.JobExecutor;
import com.fastdispatch.core.spi.RandomSource;
import com.fastdispatch.model.ctx.JobAttemptContext;

/**
 * 模拟执行：占用执行槽一段随机时长，再按尝试次数决定是否失败
 */
public class SimulatedJobExecutor implements JobExecutor {

    public static final String SIMULATED_FAILURE = "SIMULATED_FAILURE";

    private final DispatchClock clock;

    private final RandomSource random;

    public SimulatedJobExecutor(DispatchClock clock, RandomSource random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public boolean execute(JobAttemptContext ctx) {
        clock.sleep(random.serviceMillis());
        if (random.shouldFail(ctx.getAttempt())) {
            ctx.setErr(SIMULATED_FAILURE);
            return false;
        }
        return true;
    }
}
