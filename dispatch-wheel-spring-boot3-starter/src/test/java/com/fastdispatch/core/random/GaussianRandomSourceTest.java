package com.fastdispatch.core.random;

import com.fastdispatch.config.DispatchWheelProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GaussianRandomSourceTest {

    private final DispatchWheelProperties props = new DispatchWheelProperties();

    @Test
    void failureProbabilityDecaysToFloor() {
        GaussianRandomSource source = new GaussianRandomSource(props, new Random(1));

        assertThat(source.failureProbability(0)).isCloseTo(0.20, within(1e-9));
        assertThat(source.failureProbability(1)).isCloseTo(0.14, within(1e-9));
        assertThat(source.failureProbability(2)).isCloseTo(0.08, within(1e-9));
        assertThat(source.failureProbability(3)).isCloseTo(0.02, within(1e-9));
        assertThat(source.failureProbability(10)).isCloseTo(0.02, within(1e-9));
    }

    @Test
    void prioritiesCoverConfiguredRange() {
        GaussianRandomSource source = new GaussianRandomSource(props, new Random(3));

        int lo = Integer.MAX_VALUE, hi = Integer.MIN_VALUE;
        for (int i = 0; i < 2000; i++) {
            int p = source.priority();
            lo = Math.min(lo, p);
            hi = Math.max(hi, p);
        }
        assertThat(lo).isEqualTo(1);
        assertThat(hi).isEqualTo(10);
    }

    @Test
    void serviceTimeNeverBelowMinimum() {
        props.getService().setMean(Duration.ofMillis(40));
        props.getService().setStddev(Duration.ofMillis(100));
        GaussianRandomSource source = new GaussianRandomSource(props, new Random(5));

        for (int i = 0; i < 2000; i++) {
            assertThat(source.serviceMillis()).isGreaterThanOrEqualTo(30);
        }
    }

    @Test
    void zeroStddevIsDeterministic() {
        props.getService().setStddev(Duration.ZERO);
        GaussianRandomSource source = new GaussianRandomSource(props, new Random(9));

        assertThat(source.serviceMillis()).isEqualTo(300);
    }

    @Test
    void sameSeedReplaysSameSequence() {
        props.getRandom().setSeed(42L);
        GaussianRandomSource a = new GaussianRandomSource(props);
        GaussianRandomSource b = new GaussianRandomSource(props);

        for (int i = 0; i < 50; i++) {
            assertThat(a.priority()).isEqualTo(b.priority());
            assertThat(a.serviceMillis()).isEqualTo(b.serviceMillis());
            assertThat(a.shouldFail(i % 4)).isEqualTo(b.shouldFail(i % 4));
        }
    }

    @Test
    void failureRateRoughlyMatchesProbability() {
        GaussianRandomSource source = new GaussianRandomSource(props, new Random(11));

        int failures = 0;
        int n = 20000;
        for (int i = 0; i < n; i++) {
            if (source.shouldFail(0)) {
                failures++;
            }
        }
        assertThat(failures / (double) n).isCloseTo(0.20, within(0.02));
    }
}
