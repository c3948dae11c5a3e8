package com.fastdispatch.core.report;

import com.fastdispatch.core.spi.DispatchListener;
import com.fastdispatch.model.JobAttemptRecord;
import com.fastdispatch.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 控制台输出, 默认启用
 */
public class LoggingDispatchListener implements DispatchListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingDispatchListener.class);

    @Override
    public void onAttempt(JobAttemptRecord r) {
        log.info(formatAttempt(r));
    }

    @Override
    public void onRunSummary(RunSummary s) {
        log.info(formatSummary(s));
    }

    /** [Job 3 | prio=6 | att=1] wait=512ms, service=287ms, turn=799ms -> FAILED (SIMULATED_FAILURE) */
    public static String formatAttempt(JobAttemptRecord r) {
        StringBuilder sb = new StringBuilder()
                .append("[Job ").append(r.getExtId())
                .append(" | prio=").append(r.getPriority())
                .append(" | att=").append(r.getAttempt())
                .append("] wait=").append(r.getWaitMs())
                .append("ms, service=").append(r.getServiceMs())
                .append("ms, turn=").append(r.getTurnaroundMs())
                .append("ms -> ").append(r.getState());
        if (r.getFailReason() != null && !r.getFailReason().isEmpty()) {
            sb.append(" (").append(r.getFailReason()).append(')');
        }
        if (r.isRetryExhausted()) {
            sb.append(" [retries exhausted]");
        }
        return sb.toString();
    }

    public static String formatSummary(RunSummary s) {
        return String.format(Locale.ROOT,
                "%n=== RUN SUMMARY ===%n"
                        + "Total jobs: %d%n"
                        + "Success:    %d%n"
                        + "Failed:     %d%n"
                        + "Attempts:   %d (retries=%d)%n"
                        + "Avg Wait:   %.2f ms%n"
                        + "Avg Service:%.2f ms%n"
                        + "Avg Turn:   %.2f ms%n"
                        + "Throughput: %.2f jobs/s",
                s.getTotalJobs(), s.getSuccessCount(), s.getFailedCount(),
                s.getTotalAttempts(), s.getRetryCount(),
                s.getAvgWaitMs(), s.getAvgServiceMs(), s.getAvgTurnaroundMs(),
                s.getThroughputJobsPerSecond());
    }
}
