package com.fastdispatch.support;

import com.fastdispatch.core.spi.DispatchClock;

import java.util.ArrayList;
import java.util.List;

/**
 * sleep 直接推进时间，不真正阻塞
 */
public class ManualDispatchClock implements DispatchClock {

    private long now;

    private final List<Long> sleeps = new ArrayList<>();

    public ManualDispatchClock(long start) {
        this.now = start;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
        if (millis > 0) {
            now += millis;
        }
    }

    public List<Long> getSleeps() {
        return sleeps;
    }
}
