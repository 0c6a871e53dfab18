package me.christianrobert.cpp2py.batch.job;

import me.christianrobert.cpp2py.batch.model.BatchTranslationReport;
import me.christianrobert.cpp2py.batch.model.BatchTranslationRequest;
import me.christianrobert.cpp2py.batch.model.FileTranslationOutcome;
import me.christianrobert.cpp2py.batch.service.DiffRenderer;
import me.christianrobert.cpp2py.batch.service.OutputPathResolver;
import me.christianrobert.cpp2py.batch.service.SourceFileCollector;
import me.christianrobert.cpp2py.core.job.Job;
import me.christianrobert.cpp2py.core.job.exception.JobCancelledException;
import me.christianrobert.cpp2py.core.job.model.JobProgress;
import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.context.FailureKind;
import me.christianrobert.cpp2py.transformation.context.TranslationResult;
import me.christianrobert.cpp2py.transformation.service.TranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Translates every C++ source below an input path on a fixed pool of workers.
 *
 * <p>Each file is independent: an unreadable, unparseable or otherwise failing file is
 * recorded as a failed outcome and never stops the others. Failed files are never
 * written. Dry-run and show-diff modes never touch the file system.</p>
 */
public class BatchTranslationJob implements Job<BatchTranslationReport> {

    private static final Logger log = LoggerFactory.getLogger(BatchTranslationJob.class);

    private final String jobId = "batch-translation-" + UUID.randomUUID();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final BatchTranslationRequest request;
    private final TranslationService translationService;
    private final SourceFileCollector collector;
    private final OutputPathResolver pathResolver;
    private final DiffRenderer diffRenderer;

    public BatchTranslationJob(BatchTranslationRequest request, TranslationService translationService,
                               SourceFileCollector collector, OutputPathResolver pathResolver,
                               DiffRenderer diffRenderer) {
        this.request = request;
        this.translationService = translationService;
        this.collector = collector;
        this.pathResolver = pathResolver;
        this.diffRenderer = diffRenderer;
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return "BATCH_TRANSLATION";
    }

    @Override
    public String getDescription() {
        return String.format("Translate C++ sources under %s to Python (%s)", request.getInput(),
                request.getMode().name().toLowerCase().replace('_', '-'));
    }

    @Override
    public CompletableFuture<BatchTranslationReport> execute(Consumer<JobProgress> progressCallback) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return run(progressCallback);
            } catch (IOException e) {
                log.error("Batch translation failed", e);
                throw new UncheckedIOException("Batch translation failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs the batch on the calling thread (workers still run on their own pool).
     */
    public BatchTranslationReport run(Consumer<JobProgress> progressCallback) throws IOException {
        long started = System.currentTimeMillis();
        updateProgress(progressCallback, 0, "Collecting source files", request.getInput().toString());
        List<Path> sources = collector.collect(request.getInput(), request.getExtensions());

        List<FileTranslationOutcome> outcomes = new ArrayList<>(sources.size());
        ExecutorService workers = Executors.newFixedThreadPool(request.getWorkers());
        try {
            List<Future<FileTranslationOutcome>> pending = new ArrayList<>(sources.size());
            for (Path source : sources) {
                pending.add(workers.submit(() -> translateFile(source)));
            }

            for (int i = 0; i < pending.size(); i++) {
                checkCancellation();
                FileTranslationOutcome outcome = await(pending.get(i), sources.get(i));
                outcomes.add(outcome);
                updateProgress(progressCallback, JobProgress.percentageOf(i + 1, sources.size()),
                        "Translating", sources.get(i).toString());
            }
        } finally {
            workers.shutdownNow();
        }

        BatchTranslationReport report = new BatchTranslationReport(request.getInput().toString(), request.getMode(),
                outcomes, System.currentTimeMillis() - started);
        updateProgress(progressCallback, 100, "Completed",
                String.format("%d succeeded, %d failed", report.getSucceeded(), report.getFailed()));
        log.info("Batch translation completed: {} file(s), {} succeeded, {} failed",
                report.getTotalFiles(), report.getSucceeded(), report.getFailed());
        return report;
    }

    private FileTranslationOutcome await(Future<FileTranslationOutcome> future, Path source) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted while translating " + source);
        } catch (ExecutionException e) {
            log.error("Unexpected failure translating {}", source, e.getCause());
            return FileTranslationOutcome.failed(source.toString(), FailureKind.INTERNAL_ERROR,
                    "Unexpected error: " + e.getCause().getMessage(), List.of());
        }
    }

    private void checkCancellation() {
        if (isCancelled()) {
            log.info("Batch translation {} cancelled", jobId);
            throw new JobCancelledException("Batch translation was cancelled");
        }
    }

    FileTranslationOutcome translateFile(Path source) {
        String sourcePath = source.toString();
        String cppSource;
        try {
            cppSource = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", source, e.getMessage());
            return FileTranslationOutcome.failed(sourcePath, FailureKind.IO_ERROR, "Cannot read file: " + e.getMessage(),
                    List.of());
        }

        TranslationResult result = translationService.convert(cppSource, request.getRules(), request.getOptions(),
                request.isIncludeTree());
        List<String> diagnostics = result.getDiagnostics().stream()
                .map(Diagnostic::toString)
                .collect(Collectors.toList());
        if (!result.isSuccess()) {
            log.warn("Translation of {} failed: {}", source, result.getErrorMessage());
            return FileTranslationOutcome.failed(sourcePath, result.getFailureKind(), result.getErrorMessage(),
                    diagnostics);
        }

        Path target = pathResolver.resolve(source, request.getInput(), request.getOutputDirectory());
        switch (request.getMode()) {
            case DRY_RUN:
                return FileTranslationOutcome.previewed(sourcePath, target.toString(), diagnostics,
                        result.getPythonCode(), result.getTree());
            case SHOW_DIFF:
                try {
                    String existing = Files.exists(target) ? Files.readString(target, StandardCharsets.UTF_8) : "";
                    String diff = diffRenderer.unifiedDiff(target.getFileName().toString(), existing,
                            result.getPythonCode());
                    return FileTranslationOutcome.diffed(sourcePath, target.toString(), diagnostics, diff,
                            result.getTree());
                } catch (IOException e) {
                    log.warn("Cannot read existing output {}: {}", target, e.getMessage());
                    return FileTranslationOutcome.failed(sourcePath, FailureKind.IO_ERROR,
                            "Cannot read existing output: " + e.getMessage(), diagnostics);
                }
            case WRITE:
            default:
                try {
                    Path parent = target.toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    Files.writeString(target, result.getPythonCode(), StandardCharsets.UTF_8);
                    log.info("Translated {} -> {} ({} diagnostic(s))", source, target, diagnostics.size());
                    return FileTranslationOutcome.written(sourcePath, target.toString(), diagnostics,
                            result.getTree());
                } catch (IOException e) {
                    log.warn("Cannot write {}: {}", target, e.getMessage());
                    return FileTranslationOutcome.failed(sourcePath, FailureKind.IO_ERROR,
                            "Cannot write output: " + e.getMessage(), diagnostics);
                }
        }
    }
}
