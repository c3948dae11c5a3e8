package com.fastdispatch.core.random;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.spi.RandomSource;

import java.util.Random;

/**
 * 默认随机源
 * - 优先级：[min, max] 均匀分布
 * - 执行时长：正态分布，截断到下限
 * - 失败概率：随尝试次数递减，不低于 floorRate
 */
public class GaussianRandomSource implements RandomSource {

    private final Random random;

    private final DispatchWheelProperties props;

    public GaussianRandomSource(DispatchWheelProperties props) {
        this(props, props.getRandom().getSeed() == null ? new Random() : new Random(props.getRandom().getSeed()));
    }

    public GaussianRandomSource(DispatchWheelProperties props, Random random) {
        this.props = props;
        this.random = random;
    }

    @Override
    public int priority() {
        int min = props.getPriority().getMin(), max = props.getPriority().getMax();
        return min + random.nextInt(max - min + 1);
    }

    @Override
    public long serviceMillis() {
        double sample = props.serviceMeanMillis() + random.nextGaussian() * props.serviceStddevMillis();
        return Math.round(Math.max((double) props.serviceMinMillis(), sample));
    }

    @Override
    public boolean shouldFail(int attempt) {
        return random.nextDouble() < failureProbability(attempt);
    }

    /** max(floor, base - decay * attempt) */
    public double failureProbability(int attempt) {
        DispatchWheelProperties.Failure f = props.getFailure();
        return Math.max(f.getFloorRate(), f.getBaseRate() - f.getDecayPerAttempt() * attempt);
    }
}
