package com.fastdispatch.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Job状态
 */
@AllArgsConstructor
@Getter
public enum JobState {
    PENDING(0, "待调度，位于优先队列中"),
    RUNNING(1, "执行中（独占唯一执行槽）"),
    SUCCESS(2, "执行成功，终态"),
    FAILED(3, "本次尝试失败；重试耗尽时为终态")
    ;

    public final int code;
    public final String desc;
}
