package com.fastdispatch.core.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fastdispatch.core.spi.MetricsSink;
import com.fastdispatch.model.JobAttemptRecord;
import com.fastdispatch.model.RunSummary;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 追加写 JSON Lines 文件
 * {"type":"attempt",...} 每次尝试一行，{"type":"summary",...} 每次运行一行
 */
public class JsonLinesMetricsSink implements MetricsSink {

    private final Path path;

    private final ObjectMapper mapper;

    public JsonLinesMetricsSink(Path path) {
        this(path, createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JsonLinesMetricsSink(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "jsonl";
    }

    @Override
    public void recordAttempt(JobAttemptRecord record) {
        append("attempt", record);
    }

    @Override
    public void recordRunSummary(RunSummary summary) {
        append("summary", summary);
    }

    private void append(String type, Object value) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type);
        node.setAll((ObjectNode) mapper.valueToTree(value));
        String line;
        try {
            line = mapper.writeValueAsString(node) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type + " to JSON", e);
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.disable(SerializationFeature.INDENT_OUTPUT);
        m.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return m;
    }
}
