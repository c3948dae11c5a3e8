package com.fastdispatch.core.spi;

/**
 * 随机数据源：只提供数据，不含调度策略
 */
public interface RandomSource {

    /** 入队时的优先级 */
    int priority();

    /** 单次执行的模拟时长（ms） */
    long serviceMillis();

    /**
     * 本次尝试是否失败
     * @param attempt 尝试序号，从 0 开始
     */
    boolean shouldFail(int attempt);
}
