package com.fastdispatch.model.enums;

/**
 * 周转时间的计算起点
 */
public enum TurnaroundBasis {

    /** 本次尝试的入队时间（每次重试入队都会重置） */
    ATTEMPT,

    /** 任务首次提交的入队时间，包含之前所有尝试的等待与退避 */
    FIRST_SUBMISSION
}
