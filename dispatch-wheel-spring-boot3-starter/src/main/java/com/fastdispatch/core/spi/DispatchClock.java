package com.fastdispatch.core.spi;

/**
 * 时钟：单调毫秒时间戳 + 阻塞等待
 * 执行槽的退避与执行时长都通过 sleep 占用
 */
public interface DispatchClock {

    /** 单调递增的毫秒时间戳，只用于相减，不代表墙上时间 */
    long nowMillis();

    /**
     * 阻塞当前调度线程
     * @throws com.fastdispatch.exception.DispatchInterruptedException 线程被中断
     */
    void sleep(long millis);
}
