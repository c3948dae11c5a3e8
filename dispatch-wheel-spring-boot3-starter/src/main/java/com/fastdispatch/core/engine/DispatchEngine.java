package com.fastdispatch.core.engine;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.EngineOps;
import com.fastdispatch.core.backoff.BackoffRegistry;
import com.fastdispatch.core.failure.FailureDeciderHandlerFactory;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.retry.RetryPolicy;
import com.fastdispatch.core.spi.DispatchClock;
import com.fastdispatch.core.spi.DispatchListener;
import com.fastdispatch.core.spi.JobExecutor;
import com.fastdispatch.core.spi.JobScheduler;
import com.fastdispatch.core.spi.MetricsSink;
import com.fastdispatch.core.spi.RandomSource;
import com.fastdispatch.core.spi.failure.FailureDecider;
import com.fastdispatch.core.spi.failure.FailureDeciderHandler;
import com.fastdispatch.exception.DispatchInterruptedException;
import com.fastdispatch.model.DispatchJob;
import com.fastdispatch.model.JobAttemptRecord;
import com.fastdispatch.model.JobSpec;
import com.fastdispatch.model.RunSummary;
import com.fastdispatch.model.ctx.JobAttemptContext;
import com.fastdispatch.model.enums.JobState;
import com.fastdispatch.model.enums.TurnaroundBasis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 调度核心引擎
 * 单执行槽：同一时刻只有一个尝试在执行，退避与执行时长都阻塞调度线程
 */
public class DispatchEngine {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    private static final int MAX_ERR_LENGTH = 4000;

    private static final double MIN_ELAPSED_SECONDS = 0.001;

    /** 配置 */
    private final DispatchWheelProperties props;

    /** 时钟 */
    private final DispatchClock clock;

    /** 随机源（入队优先级） */
    private final RandomSource random;

    /** 任务执行器 */
    private final JobExecutor executor;

    private final BackoffRegistry backoff;

    private final RetryPolicy retryPolicy;

    /** 失败判定器 */
    private final FailureDecider failureDecider;

    /** 失败决策处理器工厂 */
    private final FailureDeciderHandlerFactory failureHandlerFactory;

    /** 指标 */
    private final DispatchMetrics meter;

    /** 持久化出口 */
    private final List<MetricsSink> sinks;

    /** 控制台/日志观察者 */
    private final List<DispatchListener> listeners;

    /** 每次运行新建队列，中断的运行不会残留任务 */
    private final Supplier<JobScheduler> schedulerFactory;

    /** 运行状态，不可重入 */
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DispatchEngine(DispatchWheelProperties props,
                          DispatchClock clock,
                          RandomSource random,
                          JobExecutor executor,
                          BackoffRegistry backoff,
                          RetryPolicy retryPolicy,
                          FailureDecider failureDecider,
                          FailureDeciderHandlerFactory failureHandlerFactory,
                          DispatchMetrics meter,
                          List<MetricsSink> sinks,
                          List<DispatchListener> listeners,
                          Supplier<JobScheduler> schedulerFactory) {
        this.props = props;
        this.clock = clock;
        this.random = random;
        this.executor = executor;
        this.backoff = backoff;
        this.retryPolicy = retryPolicy;
        this.failureDecider = failureDecider;
        this.failureHandlerFactory = failureHandlerFactory;
        this.meter = meter;
        this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.schedulerFactory = schedulerFactory;
    }

    /**
     * 执行一次完整运行：入队全部任务，排空队列后返回汇总
     */
    public RunSummary run(List<JobSpec> specs) {
        Objects.requireNonNull(specs, "specs");
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("a dispatch run is already in progress");
        }
        try {
            return doRun(specs);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private RunSummary doRun(List<JobSpec> specs) {
        JobScheduler scheduler = schedulerFactory.get();
        EngineOps ops = new DefaultEngineOps(props, backoff, retryPolicy, scheduler, clock, meter);
        RunTotals totals = new RunTotals();

        long runStart = clock.nowMillis();
        for (MetricsSink sink : sinks) {
            safely(sink.name(), "beginRun", () -> sink.beginRun(runStart));
        }
        seed(specs, scheduler, runStart);
        log.info("[Dispatch-Engine] run started, jobs={}", specs.size());

        Optional<DispatchJob> next;
        while ((next = scheduler.pop()).isPresent()) {
            dispatch(next.get(), ops, totals);
        }

        long runEnd = clock.nowMillis();
        RunSummary summary = totals.summarize(runStart, runEnd);
        for (MetricsSink sink : sinks) {
            safely(sink.name(), "recordRunSummary", () -> sink.recordRunSummary(summary));
        }
        for (DispatchListener listener : listeners) {
            safely(listener.getClass().getSimpleName(), "onRunSummary", () -> listener.onRunSummary(summary));
        }
        log.info("[Dispatch-Engine] run finished, total={}, success={}, failed={}, attempts={}, elapsed={}ms",
                summary.getTotalJobs(), summary.getSuccessCount(), summary.getFailedCount(),
                summary.getTotalAttempts(), summary.getElapsedMs());
        return summary;
    }

    /**
     * 入队时间严格递增且不晚于 runStart，保证初始同优先级按提交顺序出队
     */
    private void seed(List<JobSpec> specs, JobScheduler scheduler, long runStart) {
        int n = specs.size();
        for (int i = 0; i < n; i++) {
            JobSpec spec = specs.get(i);
            int priority = retryPolicy.clamp(spec.getPriority() != null ? spec.getPriority() : random.priority());
            scheduler.push(DispatchJob.admit(spec, priority, runStart - (n - 1 - i)));
            meter.incSubmitted();
        }
    }

    /**
     * 执行一次尝试
     */
    private void dispatch(DispatchJob job, EngineOps ops, RunTotals totals) {
        // 重试任务先退避，计入本次等待时间
        if (job.getAttempt() > 0 && job.getBackoffMs() > 0) {
            clock.sleep(job.getBackoffMs());
            meter.recordBackoffMillis(job.getBackoffMs());
        }

        long start = clock.nowMillis();
        job.setState(JobState.RUNNING);
        job.setStartTs(start);
        job.setWaitMs(start - job.getEnqueueTs());

        JobAttemptContext ctx = JobAttemptContext.builder()
                .extId(job.getExtId())
                .attempt(job.getAttempt())
                .maxRetries(job.getMaxRetries())
                .priority(job.getPriority())
                .build();

        boolean ok;
        Throwable error = null;
        try {
            ok = executor.execute(ctx);
        } catch (DispatchInterruptedException e) {
            throw e;
        } catch (Exception e) {
            ok = false;
            error = e;
            ctx.setErr(truncate(e.getMessage() == null || e.getMessage().isBlank()
                    ? e.getClass().getSimpleName() : e.getMessage()));
            log.debug("[Dispatch] job={} attempt={} executor threw", job.getExtId(), job.getAttempt(), e);
        }

        long end = clock.nowMillis();
        job.setEndTs(end);
        job.setServiceMs(end - start);
        long basis = props.getMetrics().getTurnaroundBasis() == TurnaroundBasis.FIRST_SUBMISSION
                ? job.getFirstEnqueueTs() : job.getEnqueueTs();
        job.setTurnaroundMs(end - basis);

        meter.incAttempts();
        meter.recordWaitMillis(job.getWaitMs());
        meter.recordServiceMillis(job.getServiceMs());
        meter.recordTurnaroundMillis(job.getTurnaroundMs());
        totals.attempts++;

        if (ok) {
            job.setState(JobState.SUCCESS);
            job.setFailReason(null);
            totals.succeeded(job);
            meter.incSuccess();
            meter.recordAttemptsPerJob(job.getAttempt() + 1);
            publish(JobAttemptRecord.of(job, true));
            return;
        }

        job.setState(JobState.FAILED);
        job.setFailReason(ctx.getErr() == null ? "UNKNOWN" : ctx.getErr());
        ctx.setErr(job.getFailReason());

        FailureDecider.Decision decision = decide(ctx, error);
        // 上限保护 RETRY 但重试次数已用完 → 强制改为终态失败
        if (decision.getOutcome() == FailureDecider.Outcome.RETRY && !retryPolicy.canRetry(job)) {
            decision = FailureDecider.Decision.of(FailureDecider.Outcome.FAILED)
                    .withCode("MAX_RETRY")
                    .withMsg(job.getFailReason());
        }
        boolean terminal = decision.getOutcome() != FailureDecider.Outcome.RETRY;

        // 先记录本次尝试，再由处理器修改任务并决定是否重新入队
        publish(JobAttemptRecord.of(job, terminal));

        FailureDeciderHandler h = failureHandlerFactory.get(decision);
        if (h.handle(job, ctx, decision, ops)) {
            totals.retries++;
        } else {
            totals.failed++;
            meter.recordAttemptsPerJob(job.getAttempt() + 1);
        }
    }

    private FailureDecider.Decision decide(JobAttemptContext ctx, Throwable error) {
        try {
            FailureDecider.Decision d = failureDecider.decide(ctx, error);
            if (d != null) {
                return d;
            }
            log.warn("[Dispatch] failure decider returned null for job={}, treat as FAILED", ctx.getExtId());
        } catch (RuntimeException e) {
            log.error("[Dispatch] failure decider error for job={}, treat as FAILED", ctx.getExtId(), e);
        }
        return FailureDecider.Decision.of(FailureDecider.Outcome.FAILED).withCode("DECIDER_ERROR");
    }

    /**
     * 时间戳确定之后、下一次调度之前交给 sink 与 listener
     */
    private void publish(JobAttemptRecord record) {
        for (MetricsSink sink : sinks) {
            safely(sink.name(), "recordAttempt", () -> sink.recordAttempt(record));
        }
        for (DispatchListener listener : listeners) {
            safely(listener.getClass().getSimpleName(), "onAttempt", () -> listener.onAttempt(record));
        }
    }

    /**
     * 持久化/观察者失败不影响调度
     */
    private void safely(String target, String op, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            meter.incSinkErr();
            log.error("[Sink] {} {} failed, dispatch continues", target, op, e);
        }
    }

    private static String truncate(String s) {
        return s.length() > MAX_ERR_LENGTH ? s.substring(0, MAX_ERR_LENGTH) : s;
    }

    /**
     * 运行内累计值
     */
    private static final class RunTotals {
        int attempts;
        int retries;
        int successes;
        int failed;
        long totalWait;
        long totalService;
        long totalTurnaround;

        void succeeded(DispatchJob job) {
            successes++;
            totalWait += job.getWaitMs();
            totalService += job.getServiceMs();
            totalTurnaround += job.getTurnaroundMs();
        }

        /** 平均值只统计成功任务；没有成功任务时为 0 */
        RunSummary summarize(long startedAt, long finishedAt) {
            long elapsedMs = Math.max(0, finishedAt - startedAt);
            double seconds = Math.max(MIN_ELAPSED_SECONDS, elapsedMs / 1000.0);
            return RunSummary.builder()
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .elapsedMs(elapsedMs)
                    .totalJobs(successes + failed)
                    .successCount(successes)
                    .failedCount(failed)
                    .totalAttempts(attempts)
                    .retryCount(retries)
                    .avgWaitMs(successes == 0 ? 0.0 : (double) totalWait / successes)
                    .avgServiceMs(successes == 0 ? 0.0 : (double) totalService / successes)
                    .avgTurnaroundMs(successes == 0 ? 0.0 : (double) totalTurnaround / successes)
                    .throughputJobsPerSecond(successes / seconds)
                    .build();
        }
    }
}
