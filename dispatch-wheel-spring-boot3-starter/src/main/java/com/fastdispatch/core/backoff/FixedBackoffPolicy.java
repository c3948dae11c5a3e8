package com.fastdispatch.core.backoff;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.spi.BackoffPolicy;
import com.fastdispatch.model.DispatchJob;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public long delayMillis(int failedAttempt, DispatchJob job, DispatchWheelProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getBackoff().getJitterRatio();

        long delay = base;
        if (jr > 0) {
            long jitter = Math.round((ThreadLocalRandom.current().nextDouble(-jr, jr)) * delay);
            delay += jitter;
        }
        return Math.max(0, Math.max(min, Math.min(delay, max)));
    }
}
