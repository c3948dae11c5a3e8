package com.fastdispatch.core.backoff;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.spi.BackoffPolicy;
import com.fastdispatch.model.DispatchJob;

import java.util.concurrent.ThreadLocalRandom;

public class ExponentialBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long delayMillis(int failedAttempt, DispatchJob job, DispatchWheelProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getBackoff().getJitterRatio();

        // failedAttempt从0开始计数：0 -> base, 1 -> base * 2, 2 -> base * 4 ...
        double pow = Math.pow(2.0, Math.max(0, failedAttempt));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        long jittered = ideal;
        if (jr > 0) {
            long jitter = Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal);
            jittered = ideal + jitter;
        }
        return Math.max(0, Math.max(min, Math.min(jittered, max)));
    }
}
