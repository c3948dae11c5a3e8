package com.fastdispatch.core.spi;

import com.fastdispatch.model.ctx.JobAttemptContext;

/**
 * 任务执行器，一次调用对应一次尝试
 */
public interface JobExecutor {

    /**
     * 在调度线程上同步执行
     * 返回 true=成功；返回 false（原因写入 ctx.err）或抛异常=失败（进入重试/终态策略）
     */
    boolean execute(JobAttemptContext ctx) throws Exception;
}
