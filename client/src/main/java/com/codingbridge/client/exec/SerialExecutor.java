package com.codingbridge.client.exec;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * The single serialized execution context all session state is mutated on.
 *
 * Tasks submitted through {@link #execute} and timers created by {@link #schedule}
 * never run concurrently with each other, so code running on this executor
 * may touch session state without locks.
 */
public interface SerialExecutor extends Executor {

    @Override
    void execute(Runnable task);

    /** Runs {@code task} once after {@code delay}; cancelling it before it fires suppresses it. */
    ScheduledTask schedule(Runnable task, long delay, TimeUnit unit);

    /** Clock used for activity and latency bookkeeping. */
    long currentTimeMillis();
}
