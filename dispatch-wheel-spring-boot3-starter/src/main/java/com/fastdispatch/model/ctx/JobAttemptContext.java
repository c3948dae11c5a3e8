package com.fastdispatch.model.ctx;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class JobAttemptContext {

    private int extId;
    private int attempt;
    private int maxRetries;
    private int priority;
    /** 失败原因，由执行器或引擎写入 */
    private String err;
}
