package com.fastdispatch.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class DispatchMetrics {
    private final MeterRegistry registry;
    private final Counter submitted;
    private final Counter attempts;
    private final Counter success;
    private final Counter failed;
    private final Counter retried;
    private final Counter sinkErr;
    private final DistributionSummary attemptsPerJob;
    private final Timer waitTimer;
    private final Timer serviceTimer;
    private final Timer turnaroundTimer;
    private final Timer backoffTimer;

    private DispatchMetrics(MeterRegistry reg) {
        this.registry = reg;
        this.submitted = Counter.builder("dispatch.submitted").description("jobs submitted").register(reg);
        this.attempts  = Counter.builder("dispatch.attempts").description("attempts executed").register(reg);
        this.success   = Counter.builder("dispatch.success").description("jobs succeeded").register(reg);
        this.failed    = Counter.builder("dispatch.failed").description("jobs failed after retries exhausted").register(reg);
        this.retried   = Counter.builder("dispatch.retried").description("failed attempts re-admitted").register(reg);
        this.sinkErr   = Counter.builder("dispatch.sink.error").description("metrics sink or listener errors").register(reg);
        this.attemptsPerJob = DistributionSummary.builder("dispatch.attempts.per.job")
                .description("attempt count per retired job").baseUnit("times").register(reg);
        this.waitTimer       = Timer.builder("dispatch.wait.time").description("time from enqueue to start").register(reg);
        this.serviceTimer    = Timer.builder("dispatch.service.time").description("attempt execution time").register(reg);
        this.turnaroundTimer = Timer.builder("dispatch.turnaround.time").description("time from enqueue to end").register(reg);
        this.backoffTimer    = Timer.builder("dispatch.backoff.time").description("backoff before a retried attempt").register(reg);
    }

    public static DispatchMetrics create(MeterRegistry reg) { return new DispatchMetrics(reg); }

    /** 指标所在的注册表 */
    public MeterRegistry getRegistry() { return registry; }

    public void incSubmitted(){ submitted.increment(); }
    public void incAttempts(){  attempts.increment(); }
    public void incSuccess(){   success.increment(); }
    public void incFailed(){    failed.increment(); }
    public void incRetried(){   retried.increment(); }
    public void incSinkErr(){   sinkErr.increment(); }
    public void recordAttemptsPerJob(int n){ attemptsPerJob.record(n); }
    public void recordWaitMillis(long millis){ waitTimer.record(millis, TimeUnit.MILLISECONDS); }
    public void recordServiceMillis(long millis){ serviceTimer.record(millis, TimeUnit.MILLISECONDS); }
    public void recordTurnaroundMillis(long millis){ turnaroundTimer.record(millis, TimeUnit.MILLISECONDS); }
    public void recordBackoffMillis(long millis){ backoffTimer.record(millis, TimeUnit.MILLISECONDS); }
}
