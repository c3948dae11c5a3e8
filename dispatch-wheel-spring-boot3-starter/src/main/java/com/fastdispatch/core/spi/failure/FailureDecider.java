package com.fastdispatch.core.spi.failure;

import com.fastdispatch.model.ctx.JobAttemptContext;
import lombok.Getter;

/**
 * 失败判定器 按失败原因给出决策
 */
public interface FailureDecider {

    /**
     * 根据失败做出决策
     * @param error 执行器抛出的异常，执行器返回 false 时为 null
     */
    Decision decide(JobAttemptContext ctx, Throwable error);

    @Getter
    final class Decision {
        private final Outcome outcome;
        private final double backoffFactor;
        private final String code;
        private final String message;

        private Decision(Outcome o, double f, String code, String msg) {
            this.outcome = o; this.backoffFactor = f; this.code = code; this.message = msg;
        }
        public static Decision of(Outcome o) { return new Decision(o, 1.0, null, null); }
        public Decision factor(double f){ return new Decision(outcome, f, code, message); }
        public Decision withCode(String code){ return new Decision(outcome, backoffFactor, code, message); }
        public Decision withMsg(String msg){ return new Decision(outcome, backoffFactor, code, msg); }
    }

    enum Outcome { RETRY, FAILED }
}
