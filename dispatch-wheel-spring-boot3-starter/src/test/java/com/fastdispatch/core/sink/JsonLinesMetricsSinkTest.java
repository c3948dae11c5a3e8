package com.fastdispatch.core.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fastdispatch.model.JobAttemptRecord;
import com.fastdispatch.model.RunSummary;
import com.fastdispatch.model.enums.JobState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLinesMetricsSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void appendsOneLinePerAttemptAndSummary() throws Exception {
        Path file = dir.resolve("out/attempts.jsonl");
        JsonLinesMetricsSink sink = new JsonLinesMetricsSink(file);

        sink.recordAttempt(JobAttemptRecord.builder()
                .extId(3).priority(6).attempt(1).maxRetries(2)
                .state(JobState.FAILED).failReason("SIMULATED_FAILURE")
                .enqueueTs(10).startTs(20).endTs(50)
                .waitMs(10).serviceMs(30).turnaroundMs(40).backoffMs(10)
                .terminal(false)
                .build());
        sink.recordRunSummary(RunSummary.builder()
                .startedAt(0).finishedAt(2000).elapsedMs(2000)
                .totalJobs(4).successCount(3).failedCount(1)
                .totalAttempts(6).retryCount(2)
                .avgWaitMs(12.5).avgServiceMs(300).avgTurnaroundMs(312.5)
                .throughputJobsPerSecond(1.5)
                .build());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);

        JsonNode attempt = mapper.readTree(lines.get(0));
        assertThat(attempt.get("type").asText()).isEqualTo("attempt");
        assertThat(attempt.get("extId").asInt()).isEqualTo(3);
        assertThat(attempt.get("state").asText()).isEqualTo("FAILED");
        assertThat(attempt.get("failReason").asText()).isEqualTo("SIMULATED_FAILURE");
        assertThat(attempt.get("terminal").asBoolean()).isFalse();

        JsonNode summary = mapper.readTree(lines.get(1));
        assertThat(summary.get("type").asText()).isEqualTo("summary");
        assertThat(summary.get("successCount").asInt()).isEqualTo(3);
        assertThat(summary.get("throughputJobsPerSecond").asDouble()).isEqualTo(1.5);
    }

    @Test
    void keepsExistingContent() throws Exception {
        Path file = dir.resolve("existing.jsonl");
        Files.writeString(file, "{\"type\":\"previous\"}" + System.lineSeparator());

        new JsonLinesMetricsSink(file).recordRunSummary(RunSummary.builder().build());

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("previous");
        assertThat(lines.get(1)).contains("\"type\":\"summary\"");
    }
}
