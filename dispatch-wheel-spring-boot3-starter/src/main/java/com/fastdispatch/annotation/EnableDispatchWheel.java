package com.fastdispatch.annotation;

import java.lang.annotation.*;

/**
 * 启动后自动执行一次调度（提交 dispatch.jobs 个任务并排空）
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableDispatchWheel {

    /**
     * 是否启动
     */
    boolean value() default true;
}
