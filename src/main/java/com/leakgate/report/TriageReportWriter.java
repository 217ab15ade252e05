package com.leakgate.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.leakgate.pipeline.TriageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON report of a triage run. Everything written here comes out of the pipeline already redacted.
 */
public class TriageReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(TriageReportWriter.class);

    private final ObjectMapper mapper;

    public TriageReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(TriageResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize triage report", e);
        }
    }

    public void write(TriageResult result, Path reportFile) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(reportFile, toJson(result).getBytes(StandardCharsets.UTF_8));
        logger.info("Triage report written to: {}", reportFile.toAbsolutePath());
    }
}
