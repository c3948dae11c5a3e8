package com.fastdispatch.core.backoff;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.spi.BackoffPolicy;
import com.fastdispatch.model.DispatchJob;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final DispatchWheelProperties props;

    public BackoffRegistry(DispatchWheelProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent(DEFAULT, new ExponentialBackoffPolicy());
    }

    public BackoffRegistry(DispatchWheelProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀，未知名称回落到 exponential
     */
    public BackoffPolicy resolve(@Nullable String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            String spiName = normalize(s.substring(PREFIX_SPI.length()));
            return policies.getOrDefault(spiName, policies.get(DEFAULT));
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /**
     * 按配置的策略计算退避时长
     */
    public long delayMillis(int failedAttempt, DispatchJob job) {
        return resolve(props.getBackoff().getStrategy()).delayMillis(failedAttempt, job, props);
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        // 参数校验
        long min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        if (max < min) {
            throw new IllegalArgumentException("dispatch.backoff.max must be >= dispatch.backoff.min");
        }
    }
}
