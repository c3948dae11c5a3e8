package com.fastdispatch.core.scheduler;

import com.fastdispatch.core.spi.JobScheduler;
import com.fastdispatch.model.DispatchJob;

import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * 内存优先队列
 * order by priority desc, enqueue_ts asc
 */
public class PriorityJobScheduler implements JobScheduler {

    public static final Comparator<DispatchJob> DISPATCH_ORDER = Comparator
            .comparingInt(DispatchJob::getPriority).reversed()
            .thenComparingLong(DispatchJob::getEnqueueTs);

    private final PriorityQueue<DispatchJob> queue = new PriorityQueue<>(DISPATCH_ORDER);

    @Override
    public synchronized void push(DispatchJob job) {
        queue.add(job);
    }

    @Override
    public synchronized Optional<DispatchJob> pop() {
        return Optional.ofNullable(queue.poll());
    }

    @Override
    public synchronized int size() {
        return queue.size();
    }
}
