package com.fastdispatch.core.spi;

import com.fastdispatch.model.JobAttemptRecord;
import com.fastdispatch.model.RunSummary;

/**
 * 观察者（控制台/日志），不影响调度行为
 */
public interface DispatchListener {

    default void onAttempt(JobAttemptRecord record) {
    }

    default void onRunSummary(RunSummary summary) {
    }
}
