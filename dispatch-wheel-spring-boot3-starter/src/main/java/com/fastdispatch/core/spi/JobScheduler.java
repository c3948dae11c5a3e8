package com.fastdispatch.core.spi;

import com.fastdispatch.model.DispatchJob;

import java.util.Optional;

/**
 * 待调度任务容器
 * 顺序：优先级高者先出；同优先级入队时间早者先出
 */
public interface JobScheduler {

    void push(DispatchJob job);

    /** 队列为空时返回 empty，不阻塞、不抛异常 */
    Optional<DispatchJob> pop();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
