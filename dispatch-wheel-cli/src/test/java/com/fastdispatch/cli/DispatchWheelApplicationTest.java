package com.fastdispatch.cli;

import com.fastdispatch.core.DispatchEngineRunner;
import com.fastdispatch.model.RunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchWheelApplicationTest {

    @TempDir
    Path dir;

    @Test
    void commandLineRunDrainsJobsAndPersistsAttempts() throws Exception {
        Path db = dir.resolve("dispatcher.db");
        Path jsonl = dir.resolve("attempts.jsonl");
        String[] args = DispatchArgs.toSpringArgs(new String[]{
                "--jobs", "3",
                "--max-retries", "1",
                "--mean-ms", "1",
                "--stddev-ms", "0",
                "--base-backoff-ms", "1",
                "--seed", "5",
                "--db", db.toString(),
                "--jsonl=" + jsonl,
                "--dispatch.service.min=1ms"});

        int attempts;
        try (ConfigurableApplicationContext context = SpringApplication.run(DispatchWheelApplication.class, args)) {
            RunSummary summary = context.getBean(DispatchEngineRunner.class).getLastSummary();
            assertThat(summary).isNotNull();
            assertThat(summary.getTotalJobs()).isEqualTo(3);
            assertThat(summary.getSuccessCount() + summary.getFailedCount()).isEqualTo(3);
            attempts = summary.getTotalAttempts();

            JdbcTemplate jdbc = context.getBean(JdbcTemplate.class);
            assertThat(jdbc.queryForObject("select count(*) from runs where finished_at is not null", Integer.class))
                    .isEqualTo(1);
            assertThat(jdbc.queryForObject("select count(*) from jobs", Integer.class))
                    .isEqualTo(summary.getTotalAttempts());
            assertThat(jdbc.queryForObject("select count(*) from jobs where terminal = 1", Integer.class))
                    .isEqualTo(3);
            assertThat(jdbc.queryForObject("select count(distinct run_id) from jobs", Integer.class))
                    .isEqualTo(1);
        }

        List<String> lines = Files.readAllLines(jsonl);
        assertThat(lines).hasSize(attempts + 1);
        assertThat(lines.get(lines.size() - 1)).contains("\"type\":\"summary\"");
        assertThat(lines.subList(0, lines.size() - 1)).allMatch(l -> l.contains("\"type\":\"attempt\""));
    }
}
