package com.codingbridge.client.exec;

import io.netty.channel.DefaultEventLoop;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * {@link SerialExecutor} backed by a single-threaded Netty event loop.
 *
 * One daemon thread owns all session state; transport I/O threads hand
 * decoded frames over by submitting tasks here.
 */
public final class EventLoopSerialExecutor implements SerialExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoopSerialExecutor.class);

    private final EventExecutor loop;

    public EventLoopSerialExecutor(String name) {
        this(new DefaultEventLoop(new DefaultThreadFactory(name, true)));
    }

    public EventLoopSerialExecutor(EventExecutor loop) {
        this.loop = loop;
    }

    @Override
    public void execute(Runnable task) {
        loop.execute(() -> runGuarded(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delay, TimeUnit unit) {
        Timer timer = new Timer(task);
        timer.future = loop.schedule(timer, delay, unit);
        return timer;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public void close() {
        loop.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private static void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Session task failed", e);
        }
    }

    private static final class Timer implements ScheduledTask, Runnable {
        private final Runnable task;
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        Timer(Runnable task) {
            this.task = task;
        }

        @Override
        public void run() {
            if (!cancelled) runGuarded(task);
        }

        @Override
        public void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
