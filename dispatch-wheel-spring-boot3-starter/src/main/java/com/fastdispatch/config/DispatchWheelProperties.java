package com.fastdispatch.config;

import com.fastdispatch.model.enums.TurnaroundBasis;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 调度器配置（绑定前缀：dispatch）
 *
 * YAML 示例：
 * dispatch:
 *   jobs: 12
 *   default-max-retry: 2
 *   priority:
 *     min: 1
 *     max: 10
 *     retry-boost: 1
 *   service:
 *     mean: 300ms
 *     stddev: 100ms
 *     min: 30ms
 *   failure:
 *     base-rate: 0.20
 *     decay-per-attempt: 0.06
 *     floor-rate: 0.02
 *   backoff:
 *     strategy: exponential
 *     base: 100ms
 *     min: 0ms
 *     max: 60s
 *     jitter-ratio: 0
 *   random:
 *     seed: 42
 *   metrics:
 *     turnaround-basis: ATTEMPT
 *   sink:
 *     db:
 *       enabled: true
 *     jsonl:
 *       path: ./dispatch-attempts.jsonl
 *   runner:
 *     enabled: false
 */
@Validated
@ConfigurationProperties(prefix = "dispatch")
public class DispatchWheelProperties {

    /** 启动时自动提交的任务数量 */
    @Min(1)
    private int jobs = 12;

    /** 默认最大重试次数（不含首次执行） */
    @Min(0)
    private int defaultMaxRetry = 2;

    @Valid
    private Priority priority = new Priority();

    @Valid
    private Service service = new Service();

    @Valid
    private Failure failure = new Failure();

    @Valid
    private Backoff backoff = new Backoff();

    private Random random = new Random();

    @Valid
    private Metrics metrics = new Metrics();

    private Sink sink = new Sink();

    private Runner runner = new Runner();

    // ----------------- 嵌套配置对象 -----------------

    public static class Priority {
        /** 最低优先级 */
        @Min(1)
        private int min = 1;

        /** 最高优先级，重试提权不会超过该值 */
        @Min(1)
        private int max = 10;

        /** 每次失败重试的提权幅度 */
        @Min(0)
        private int retryBoost = 1;

        public int getMin() { return min; }
        public void setMin(int min) { this.min = min; }
        public int getMax() { return max; }
        public void setMax(int max) { this.max = max; }
        public int getRetryBoost() { return retryBoost; }
        public void setRetryBoost(int retryBoost) { this.retryBoost = retryBoost; }
    }

    public static class Service {
        /** 模拟执行时长均值 */
        @NotNull
        @DurationMin(millis = 0)
        private Duration mean = Duration.ofMillis(300);

        /** 模拟执行时长标准差 */
        @NotNull
        @DurationMin(millis = 0)
        private Duration stddev = Duration.ofMillis(100);

        /** 模拟执行时长下限 */
        @NotNull
        @DurationMin(millis = 0)
        private Duration min = Duration.ofMillis(30);

        public Duration getMean() { return mean; }
        public void setMean(Duration mean) { this.mean = mean; }
        public Duration getStddev() { return stddev; }
        public void setStddev(Duration stddev) { this.stddev = stddev; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
    }

    public static class Failure {
        /** 首次执行的失败概率 */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double baseRate = 0.20;

        /** 每多一次尝试降低的失败概率 */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double decayPerAttempt = 0.06;

        /** 失败概率下限（大于 0，重试永远不保证成功） */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double floorRate = 0.02;

        public double getBaseRate() { return baseRate; }
        public void setBaseRate(double baseRate) { this.baseRate = baseRate; }
        public double getDecayPerAttempt() { return decayPerAttempt; }
        public void setDecayPerAttempt(double decayPerAttempt) { this.decayPerAttempt = decayPerAttempt; }
        public double getFloorRate() { return floorRate; }
        public void setFloorRate(double floorRate) { this.floorRate = floorRate; }
    }

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔（指数退避的 base） */
        @NotNull
        @DurationMin(millis = 0)
        private Duration base = Duration.ofMillis(100);

        /** 最小间隔 */
        @NotNull
        @DurationMin(millis = 0)
        private Duration min = Duration.ZERO;

        /** 最大间隔 */
        @NotNull
        @DurationMin(millis = 0)
        private Duration max = Duration.ofSeconds(60);

        /** 抖动比例（0~1），0 表示严格翻倍 */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double jitterRatio = 0.0;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    public static class Random {
        /** 固定种子，为空时每次运行随机 */
        private Long seed;

        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }

    public static class Metrics {
        /** 周转时间的起点：ATTEMPT（本次入队）| FIRST_SUBMISSION（首次提交） */
        @NotNull
        private TurnaroundBasis turnaroundBasis = TurnaroundBasis.ATTEMPT;

        public TurnaroundBasis getTurnaroundBasis() { return turnaroundBasis; }
        public void setTurnaroundBasis(TurnaroundBasis turnaroundBasis) { this.turnaroundBasis = turnaroundBasis; }
    }

    public static class Sink {
        private Db db = new Db();

        private Jsonl jsonl = new Jsonl();

        public Db getDb() { return db; }
        public void setDb(Db db) { this.db = db; }
        public Jsonl getJsonl() { return jsonl; }
        public void setJsonl(Jsonl jsonl) { this.jsonl = jsonl; }

        public static class Db {
            /** 存在 DataSource 时是否落库 */
            private boolean enabled = true;

            public boolean isEnabled() { return enabled; }
            public void setEnabled(boolean enabled) { this.enabled = enabled; }
        }

        public static class Jsonl {
            /** JSON Lines 输出文件，为空则不启用 */
            private String path;

            public String getPath() { return path; }
            public void setPath(String path) { this.path = path; }
        }
    }

    public static class Runner {
        /** 启动后是否自动执行一次调度（@EnableDispatchWheel 会打开） */
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public int getJobs() { return jobs; }
    public void setJobs(int jobs) { this.jobs = jobs; }

    public int getDefaultMaxRetry() { return defaultMaxRetry; }
    public void setDefaultMaxRetry(int defaultMaxRetry) { this.defaultMaxRetry = defaultMaxRetry; }

    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }

    public Service getService() { return service; }
    public void setService(Service service) { this.service = service; }

    public Failure getFailure() { return failure; }
    public void setFailure(Failure failure) { this.failure = failure; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Random getRandom() { return random; }
    public void setRandom(Random random) { this.random = random; }

    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }

    public Sink getSink() { return sink; }
    public void setSink(Sink sink) { this.sink = sink; }

    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }

    // ----------------- 便捷换算 -----------------

    /** 退避：基础/最小/最大毫秒 */
    public long backoffBaseMillis() { return backoff.getBase().toMillis(); }
    public long backoffMinMillis() { return backoff.getMin().toMillis(); }
    public long backoffMaxMillis() { return backoff.getMax().toMillis(); }

    /** 模拟执行：均值/标准差/下限毫秒 */
    public long serviceMeanMillis() { return service.getMean().toMillis(); }
    public long serviceStddevMillis() { return service.getStddev().toMillis(); }
    public long serviceMinMillis() { return service.getMin().toMillis(); }
}
