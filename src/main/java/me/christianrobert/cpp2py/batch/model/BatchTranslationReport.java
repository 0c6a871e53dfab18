package me.christianrobert.cpp2py.batch.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Summary of a batch run: one outcome per source file, in source order.
 */
@JsonPropertyOrder({"input", "mode", "totalFiles", "succeeded", "failed", "diagnosticCount", "durationMillis",
        "outcomes"})
public class BatchTranslationReport {

    private final String input;
    private final OutputMode mode;
    private final List<FileTranslationOutcome> outcomes;
    private final long durationMillis;

    public BatchTranslationReport(String input, OutputMode mode, List<FileTranslationOutcome> outcomes,
                                  long durationMillis) {
        this.input = input;
        this.mode = mode;
        this.outcomes = List.copyOf(outcomes);
        this.durationMillis = durationMillis;
    }

    public String getInput() {
        return input;
    }

    public OutputMode getMode() {
        return mode;
    }

    public List<FileTranslationOutcome> getOutcomes() {
        return outcomes;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public int getTotalFiles() {
        return outcomes.size();
    }

    public int getSucceeded() {
        return (int) outcomes.stream().filter(FileTranslationOutcome::isSuccess).count();
    }

    public int getFailed() {
        return getTotalFiles() - getSucceeded();
    }

    public int getDiagnosticCount() {
        return outcomes.stream().mapToInt(o -> o.getDiagnostics().size()).sum();
    }

    public List<FileTranslationOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).collect(Collectors.toList());
    }

    public boolean allSucceeded() {
        return getFailed() == 0;
    }
}
