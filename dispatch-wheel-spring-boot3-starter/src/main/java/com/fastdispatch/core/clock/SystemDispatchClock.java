package com.fastdispatch.core.clock;

import com.fastdispatch.core.spi.DispatchClock;
import com.fastdispatch.exception.DispatchInterruptedException;

import java.util.concurrent.TimeUnit;

/**
 * 基于 System.nanoTime 的单调时钟
 */
public class SystemDispatchClock implements DispatchClock {

    @Override
    public long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchInterruptedException("dispatch thread interrupted while waiting " + millis + "ms", e);
        }
    }
}
