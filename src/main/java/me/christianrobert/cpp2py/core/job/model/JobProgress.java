package me.christianrobert.cpp2py.core.job.model;

import java.time.LocalDateTime;

/**
 * Snapshot of a job's progress, handed to progress callbacks.
 */
public class JobProgress {
    private final int percentage;
    private final String currentTask;
    private final String details;
    private final LocalDateTime lastUpdated;

    public JobProgress(int percentage, String currentTask) {
        this(percentage, currentTask, "");
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this.percentage = Math.max(0, Math.min(100, percentage));
        this.currentTask = currentTask != null ? currentTask : "";
        this.details = details != null ? details : "";
        this.lastUpdated = LocalDateTime.now();
    }

    /**
     * Percentage of {@code done} out of {@code total}, 100 when there is nothing to do.
     */
    public static int percentageOf(int done, int total) {
        return total == 0 ? 100 : (int) ((long) done * 100 / total);
    }

    public int getPercentage() {
        return percentage;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public String getDetails() {
        return details;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "JobProgress{" +
                "percentage=" + percentage +
                ", currentTask='" + currentTask + '\'' +
                ", details='" + details + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
