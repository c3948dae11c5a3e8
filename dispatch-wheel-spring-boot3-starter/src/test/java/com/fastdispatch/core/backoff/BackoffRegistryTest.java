package com.fastdispatch.core.backoff;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.spi.BackoffPolicy;
import com.fastdispatch.model.DispatchJob;
import com.fastdispatch.model.JobSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRegistryTest {

    private DispatchWheelProperties props;

    private DispatchJob job;

    @BeforeEach
    void setUp() {
        props = new DispatchWheelProperties();
        props.getBackoff().setBase(Duration.ofMillis(100));
        job = DispatchJob.admit(JobSpec.of(1, 5), 5, 0);
    }

    @Test
    void exponentialDoublesPerFailedAttempt() {
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.delayMillis(0, job)).isEqualTo(100);
        assertThat(registry.delayMillis(1, job)).isEqualTo(200);
        assertThat(registry.delayMillis(2, job)).isEqualTo(400);
        assertThat(registry.delayMillis(3, job)).isEqualTo(800);
    }

    @Test
    void exponentialIsClampedToMax() {
        props.getBackoff().setMax(Duration.ofMillis(300));
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.delayMillis(2, job)).isEqualTo(300);
        assertThat(registry.delayMillis(62, job)).isEqualTo(300);
    }

    @Test
    void jitterStaysWithinRatio() {
        props.getBackoff().setJitterRatio(0.2);
        BackoffPolicy policy = new ExponentialBackoffPolicy();

        for (int i = 0; i < 200; i++) {
            assertThat(policy.delayMillis(1, job, props)).isBetween(160L, 240L);
        }
    }

    @Test
    void fixedIgnoresAttempt() {
        props.getBackoff().setStrategy("fixed");
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.delayMillis(0, job)).isEqualTo(100);
        assertThat(registry.delayMillis(4, job)).isEqualTo(100);
    }

    @Test
    void resolvesExternalPolicyByName() {
        BackoffPolicy linear = new BackoffPolicy() {
            @Override
            public String name() {
                return "linear";
            }

            @Override
            public long delayMillis(int failedAttempt, DispatchJob job, DispatchWheelProperties p) {
                return p.backoffBaseMillis() * (failedAttempt + 1);
            }
        };
        props.getBackoff().setStrategy("spi:Linear");
        BackoffRegistry registry = new BackoffRegistry(props, List.of(linear));

        assertThat(registry.names()).contains("linear", "fixed", "exponential");
        assertThat(registry.delayMillis(2, job)).isEqualTo(300);
    }

    @Test
    void unknownStrategyFallsBackToExponential() {
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThat(registry.resolve("spi:missing")).isInstanceOf(ExponentialBackoffPolicy.class);
        assertThat(registry.resolve("nope")).isInstanceOf(ExponentialBackoffPolicy.class);
        assertThat(registry.resolve(null)).isInstanceOf(ExponentialBackoffPolicy.class);
    }

    @Test
    void rejectsMaxBelowMin() {
        props.getBackoff().setMin(Duration.ofSeconds(5));
        props.getBackoff().setMax(Duration.ofSeconds(1));
        BackoffRegistry registry = new BackoffRegistry(props);

        assertThatThrownBy(registry::afterPropertiesSet).isInstanceOf(IllegalArgumentException.class);
    }
}
