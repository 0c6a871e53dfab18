package me.christianrobert.cpp2py.core.job.exception;

/**
 * Thrown when a job notices at a checkpoint that it was cancelled.
 *
 * This is cooperative cancellation, not an error: files already translated keep their
 * output, remaining files are skipped.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException() {
        super("Job was cancelled");
    }

    public JobCancelledException(String message) {
        super(message);
    }
}
