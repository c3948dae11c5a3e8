package com.fastdispatch.support;

import com.fastdispatch.core.spi.RandomSource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 按脚本返回优先级与失败结果，脚本用完后使用默认值
 */
public class ScriptedRandomSource implements RandomSource {

    private final Deque<Integer> priorities = new ArrayDeque<>();

    private final Deque<Boolean> failures = new ArrayDeque<>();

    private final List<Integer> askedAttempts = new ArrayList<>();

    private final long serviceMs;

    private boolean failByDefault;

    private static final int DEFAULT_PRIORITY = 5;

    public ScriptedRandomSource(long serviceMs) {
        this.serviceMs = serviceMs;
    }

    public static ScriptedRandomSource alwaysSucceed(long serviceMs) {
        return new ScriptedRandomSource(serviceMs);
    }

    public static ScriptedRandomSource alwaysFail(long serviceMs) {
        ScriptedRandomSource r = new ScriptedRandomSource(serviceMs);
        r.failByDefault = true;
        return r;
    }

    public ScriptedRandomSource priorities(Integer... values) {
        priorities.addAll(List.of(values));
        return this;
    }

    public ScriptedRandomSource outcomes(Boolean... fail) {
        failures.addAll(List.of(fail));
        return this;
    }

    @Override
    public int priority() {
        return priorities.isEmpty() ? DEFAULT_PRIORITY : priorities.poll();
    }

    @Override
    public long serviceMillis() {
        return serviceMs;
    }

    @Override
    public boolean shouldFail(int attempt) {
        askedAttempts.add(attempt);
        return failures.isEmpty() ? failByDefault : failures.poll();
    }

    public List<Integer> getAskedAttempts() {
        return askedAttempts;
    }
}
