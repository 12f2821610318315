package com.codingbridge.client.exec;

/**
 * Handle to a pending timer. Cancellation is cooperative: a cancelled task
 * simply does not run its effect.
 */
public interface ScheduledTask {

    void cancel();

    boolean isCancelled();

    /** Null-safe cancel, returns null so callers can write {@code task = ScheduledTask.cancel(task)}. */
    static ScheduledTask cancel(ScheduledTask task) {
        if (task != null) task.cancel();
        return null;
    }
}
