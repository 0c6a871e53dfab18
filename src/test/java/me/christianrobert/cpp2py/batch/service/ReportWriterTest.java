package me.christianrobert.cpp2py.batch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.christianrobert.cpp2py.batch.model.BatchTranslationReport;
import me.christianrobert.cpp2py.batch.model.FileTranslationOutcome;
import me.christianrobert.cpp2py.batch.model.OutputMode;
import me.christianrobert.cpp2py.transformation.context.FailureKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    private final ReportWriter writer = new ReportWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    private static BatchTranslationReport report() {
        return new BatchTranslationReport("src", OutputMode.WRITE, List.of(
                FileTranslationOutcome.written("src/a.cpp", "out/a.py",
                        List.of("UNSUPPORTED_CONSTRUCT at line 3, column 5: switch statement"), null),
                FileTranslationOutcome.failed("src/b.cpp", FailureKind.PARSE_ERROR, "Parse errors: Line 1:4 - x",
                        List.of())), 42);
    }

    @Test
    void summaryFieldsComeFirst() throws IOException {
        JsonNode json = mapper.readTree(writer.toJson(report()));

        assertEquals("input", json.fieldNames().next());
        assertEquals("src", json.get("input").asText());
        assertEquals("WRITE", json.get("mode").asText());
        assertEquals(2, json.get("totalFiles").asInt());
        assertEquals(1, json.get("succeeded").asInt());
        assertEquals(1, json.get("failed").asInt());
        assertEquals(1, json.get("diagnosticCount").asInt());
        assertEquals(42, json.get("durationMillis").asLong());
    }

    @Test
    void outcomesOmitAbsentFields() throws IOException {
        JsonNode outcomes = mapper.readTree(writer.toJson(report())).get("outcomes");

        JsonNode written = outcomes.get(0);
        assertTrue(written.get("success").asBoolean());
        assertEquals("out/a.py", written.get("outputPath").asText());
        assertFalse(written.has("failureKind"));
        assertFalse(written.has("preview"));

        JsonNode failed = outcomes.get(1);
        assertFalse(failed.get("success").asBoolean());
        assertEquals("PARSE_ERROR", failed.get("failureKind").asText());
        assertFalse(failed.has("outputPath"));
    }

    @Test
    void writeCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("reports/run.json");

        writer.write(report(), target);

        assertTrue(Files.exists(target));
        assertEquals(2, mapper.readTree(target.toFile()).get("totalFiles").asInt());
    }
}
