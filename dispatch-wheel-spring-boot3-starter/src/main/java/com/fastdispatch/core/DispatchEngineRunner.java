package com.fastdispatch.core;

import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.engine.DispatchEngine;
import com.fastdispatch.model.JobSpec;
import com.fastdispatch.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.ArrayList;
import java.util.List;

/**
 * 应用启动后执行一次调度
 * dispatch.runner.enabled=false 时跳过
 */
public class DispatchEngineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngineRunner.class);

    private final DispatchEngine engine;

    private final DispatchWheelProperties props;

    private volatile RunSummary lastSummary;

    public DispatchEngineRunner(DispatchEngine engine, DispatchWheelProperties props) {
        this.engine = engine;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.getRunner().isEnabled()) {
            log.info("[Dispatch-Engine] runner disabled, skip startup run");
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ DispatchEngine starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ jobs               : {}", props.getJobs());
            log.info("│ max-retry          : {}", props.getDefaultMaxRetry());
            log.info("│ priority           : {}..{} (+{} per retry)", props.getPriority().getMin(),
                    props.getPriority().getMax(), props.getPriority().getRetryBoost());
            log.info("│ service            : mean={}ms stddev={}ms min={}ms", props.serviceMeanMillis(),
                    props.serviceStddevMillis(), props.serviceMinMillis());
            log.info("│ backoff.strategy   : {} (base={}ms)", props.getBackoff().getStrategy(), props.backoffBaseMillis());
            log.info("│ turnaround.basis   : {}", props.getMetrics().getTurnaroundBasis());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            // 启动日志打印本身不应阻断运行
            log.warn("[Dispatch-Engine] failed to render startup banner: {}", t.toString());
        }
        lastSummary = engine.run(initialJobs());
    }

    /**
     * 1..N，统一使用默认最大重试次数
     */
    public List<JobSpec> initialJobs() {
        List<JobSpec> specs = new ArrayList<>(props.getJobs());
        for (int i = 1; i <= props.getJobs(); i++) {
            specs.add(JobSpec.of(i, props.getDefaultMaxRetry()));
        }
        return specs;
    }

    public RunSummary getLastSummary() {
        return lastSummary;
    }
}
