package com.fastdispatch.core.failure;

import com.fastdispatch.core.spi.failure.FailureDecider;
import com.fastdispatch.core.spi.failure.FailureDeciderHandler;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 失败决策处理器注册中心
 */
public class FailureDeciderHandlerFactory {

    private final Map<FailureDecider.Outcome, FailureDeciderHandler> policies = new ConcurrentHashMap<>(4);

    public FailureDeciderHandlerFactory(List<FailureDeciderHandler> handlers) {
        if (handlers != null) {
            handlers.forEach(p -> registry(p.support(), p));
        }
    }

    public FailureDeciderHandler get(FailureDecider.Decision k) {
        return get(k.getOutcome());
    }

    /**
     * 没有对应处理器 -> 按终态失败处理
     */
    public FailureDeciderHandler get(FailureDecider.Outcome k) {
        return policies.getOrDefault(k, policies.get(FailureDecider.Outcome.FAILED));
    }

    public FailureDeciderHandlerFactory registry(FailureDecider.Outcome k, FailureDeciderHandler v) {
        policies.put(k, v);
        return this;
    }

    /** 列出已注册处理器 */
    public Set<FailureDecider.Outcome> names() { return Collections.unmodifiableSet(policies.keySet()); }
}
