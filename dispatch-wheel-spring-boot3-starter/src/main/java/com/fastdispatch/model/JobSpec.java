package com.fastdispatch.model;

import lombok.Builder;
import lombok.Data;

/**
 * 提交参数
 */
@Data
@Builder
public class JobSpec {

    /** 外部编号，1..N，重试不变 */
    private int extId;

    /** 最大重试次数 */
    private int maxRetries;

    /** 指定优先级，为空时由 RandomSource 生成 */
    private Integer priority;

    public static JobSpec of(int extId, int maxRetries) {
        return of(extId, maxRetries, null);
    }

    public static JobSpec of(int extId, int maxRetries, Integer priority) {
        if (extId < 1) {
            throw new IllegalArgumentException("extId must be >= 1, got " + extId);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        return JobSpec.builder().extId(extId).maxRetries(maxRetries).priority(priority).build();
    }
}
