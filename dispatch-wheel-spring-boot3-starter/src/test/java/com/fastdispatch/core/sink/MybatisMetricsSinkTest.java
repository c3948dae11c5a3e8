package com.fastdispatch.core.sink;

import com.fastdispatch.DispatchWheelTestApplication;
import com.fastdispatch.core.engine.DispatchEngine;
import com.fastdispatch.mapper.DispatchRunMapper;
import com.fastdispatch.mapper.JobAttemptMapper;
import com.fastdispatch.model.JobSpec;
import com.fastdispatch.model.RunSummary;
import com.fastdispatch.model.entity.DispatchRunEntity;
import com.fastdispatch.model.entity.JobAttemptEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = DispatchWheelTestApplication.class, properties = {
        "dispatch.service.mean=1ms",
        "dispatch.service.stddev=0ms",
        "dispatch.service.min=1ms",
        "dispatch.backoff.base=1ms",
        "dispatch.failure.base-rate=0.5",
        "dispatch.failure.decay-per-attempt=0.1",
        "dispatch.failure.floor-rate=0.2",
        "dispatch.random.seed=42",
        "spring.datasource.driver-class-name=org.sqlite.JDBC",
        "spring.datasource.hikari.maximum-pool-size=1"
})
class MybatisMetricsSinkTest {

    @DynamicPropertySource
    static void sqlite(DynamicPropertyRegistry registry) {
        Path db;
        try {
            db = Files.createTempDirectory("dispatch-wheel").resolve("dispatcher.db");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("spring.datasource.url", () -> "jdbc:sqlite:" + db);
    }

    @Autowired
    private DispatchEngine engine;

    @Autowired
    private MybatisMetricsSink sink;

    @Autowired
    private DispatchRunMapper runMapper;

    @Autowired
    private JobAttemptMapper jobMapper;

    @Test
    void everyAttemptIsStoredUnderItsRun() {
        List<JobSpec> specs = IntStream.rangeClosed(1, 8).mapToObj(i -> JobSpec.of(i, 2)).collect(Collectors.toList());

        RunSummary summary = engine.run(specs);

        assertThat(sink.getCurrentRunId()).isNull();
        DispatchRunEntity run = latestRun();
        assertThat(run.getStartedAt()).isEqualTo(summary.getStartedAt());
        assertThat(run.getFinishedAt()).isEqualTo(summary.getFinishedAt());
        assertThat(run.getTotalJobs()).isEqualTo(8);
        assertThat(run.getSuccessJobs()).isEqualTo(summary.getSuccessCount());
        assertThat(run.getFailedJobs()).isEqualTo(summary.getFailedCount());
        assertThat(run.getAvgWaitMs()).isEqualTo(summary.getAvgWaitMs());
        assertThat(run.getThroughputJobsPerS()).isEqualTo(summary.getThroughputJobsPerSecond());

        List<JobAttemptEntity> rows = jobMapper.selectByRun(run.getRunId());
        assertThat(rows).hasSize(summary.getTotalAttempts());
        assertThat(rows).allMatch(r -> r.getRunId().equals(run.getRunId()));
        assertThat(rows).extracting(JobAttemptEntity::getExtId).containsOnly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(rows).filteredOn(r -> "SUCCESS".equals(r.getStatus()))
                .allMatch(r -> r.getFailReason().isEmpty() && r.getTerminal() == 1);
        assertThat(rows).filteredOn(r -> "FAILED".equals(r.getStatus()))
                .allMatch(r -> "SIMULATED_FAILURE".equals(r.getFailReason()));
        assertThat(rows).allMatch(r -> r.getStartTs() >= r.getEnqueueTs() && r.getEndTs() >= r.getStartTs());

        assertThat(jobMapper.countTerminal(run.getRunId(), "SUCCESS")).isEqualTo(summary.getSuccessCount());
        assertThat(jobMapper.countTerminal(run.getRunId(), "FAILED")).isEqualTo(summary.getFailedCount());
    }

    @Test
    void eachRunGetsItsOwnRow() {
        long before = runMapper.selectCount(null);

        engine.run(List.of(JobSpec.of(1, 0)));
        long firstRunId = latestRun().getRunId();
        engine.run(List.of(JobSpec.of(1, 0), JobSpec.of(2, 0)));
        long secondRunId = latestRun().getRunId();

        assertThat(runMapper.selectCount(null)).isEqualTo(before + 2);
        // 自增主键，运行编号连续
        assertThat(secondRunId).isEqualTo(firstRunId + 1);
        List<JobAttemptEntity> rows = jobMapper.selectByRun(secondRunId);
        assertThat(rows).hasSize(2);
        assertThat(rows.get(1).getJobId()).isEqualTo(rows.get(0).getJobId() + 1);
    }

    @Test
    void runIdsStartAtOneInFreshDatabase() {
        List<DispatchRunEntity> runs = runMapper.selectList(null);
        long smallest = runs.isEmpty() ? nextRunId() : runs.stream().mapToLong(DispatchRunEntity::getRunId).min().orElseThrow();

        assertThat(smallest).isEqualTo(1L);
    }

    private long nextRunId() {
        engine.run(List.of(JobSpec.of(1, 0)));
        return latestRun().getRunId();
    }

    @Test
    void summaryWithoutOpenRunIsInserted() {
        long before = runMapper.selectCount(null);

        sink.recordRunSummary(RunSummary.builder().startedAt(1).finishedAt(2).elapsedMs(1).build());

        assertThat(runMapper.selectCount(null)).isEqualTo(before + 1);
    }

    private DispatchRunEntity latestRun() {
        return runMapper.selectList(null).stream()
                .filter(r -> r.getFinishedAt() != null)
                .max((a, b) -> Long.compare(a.getStartedAt(), b.getStartedAt()))
                .orElseThrow();
    }
}
