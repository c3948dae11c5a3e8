package com.fastdispatch.exception;

/**
 * 调度线程在退避或执行等待中被中断
 */
public class DispatchInterruptedException extends RuntimeException {

    public DispatchInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
