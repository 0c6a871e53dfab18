package me.christianrobert.cpp2py.core.job;

import me.christianrobert.cpp2py.core.job.model.JobProgress;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A long-running unit of work that reports progress and can be cancelled cooperatively.
 *
 * @param <T> result type
 */
public interface Job<T> {

    String getJobId();

    String getJobType();

    String getDescription();

    CompletableFuture<T> execute(Consumer<JobProgress> progressCallback);

    /**
     * Requests cancellation. The job stops at its next checkpoint by throwing
     * {@link me.christianrobert.cpp2py.core.job.exception.JobCancelledException}.
     */
    void cancel();

    boolean isCancelled();

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask));
        }
    }

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask, String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask, details));
        }
    }
}
