package me.christianrobert.cpp2py.batch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.cpp2py.batch.model.BatchTranslationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes batch reports as JSON.
 */
@ApplicationScoped
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(BatchTranslationReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(report);
    }

    public void write(BatchTranslationReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(report), StandardCharsets.UTF_8);
        log.info("Wrote translation report for {} file(s) to {}", report.getTotalFiles(), target);
    }
}
