package com.fastdispatch.core.engine;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.EngineOps;
import com.fastdispatch.core.backoff.BackoffRegistry;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.retry.RetryPolicy;
import com.fastdispatch.core.spi.DispatchClock;
import com.fastdispatch.core.spi.JobScheduler;

public class DefaultEngineOps implements EngineOps {

    private final DispatchWheelProperties props;
    private final BackoffRegistry backoff;
    private final RetryPolicy retryPolicy;
    private final JobScheduler scheduler;
    private final DispatchClock clock;
    private final DispatchMetrics meter;

    public DefaultEngineOps(DispatchWheelProperties props,
                            BackoffRegistry backoff,
                            RetryPolicy retryPolicy,
                            JobScheduler scheduler,
                            DispatchClock clock,
                            DispatchMetrics meter) {
        this.props = props;
        this.backoff = backoff;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.clock = clock;
        this.meter = meter;
    }

    @Override
    public DispatchWheelProperties props() {
        return props;
    }

    @Override
    public BackoffRegistry backoff() {
        return backoff;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    public JobScheduler scheduler() {
        return scheduler;
    }

    @Override
    public DispatchClock clock() {
        return clock;
    }

    @Override
    public DispatchMetrics meter() {
        return meter;
    }
}
