package com.fastdispatch.core.spi;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.model.DispatchJob;

/**
 * 回退策略（计算重试前的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算退避时长
     * @param failedAttempt 刚失败的尝试序号（从 0 开始，第一次重试传 0）
     * @param job           任务（如需读取优先级等属性）
     * @param props         全局配置（读取 base/min/max/jitterRatio 等）
     * @return 毫秒，不小于 0
     */
    long delayMillis(int failedAttempt, DispatchJob job, DispatchWheelProperties props);
}
