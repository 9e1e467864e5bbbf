package com.bftchain.timer;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RoundTimerImpl implements RoundTimer {

    private final ScheduledExecutorService scheduler;
    private Consumer<TimeoutInfo> timeoutHandler;
    private ScheduledFuture<?> scheduledTask;
    private TimeoutInfo pending;

    public RoundTimerImpl(String name) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "round-timer-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void schedule(TimeoutInfo timeout) {
        if (timeoutHandler == null) {
            throw new IllegalStateException("Timeout handler not set");
        }
        cancel();
        pending = timeout;
        log.trace("Scheduling {} in {}ms", timeout, timeout.getDurationMs());
        scheduledTask = scheduler.schedule(() -> handleTimeout(timeout), timeout.getDurationMs(),
                TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void cancel() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        pending = null;
    }

    @Override
    public synchronized void setTimeoutHandler(Consumer<TimeoutInfo> handler) {
        this.timeoutHandler = handler;
    }

    public synchronized TimeoutInfo getPending() {
        return pending;
    }

    /**
     * A cancel racing with expiry can lose; the handler then sees a timeout
     * that is no longer pending and drops it here.
     */
    private void handleTimeout(TimeoutInfo timeout) {
        Consumer<TimeoutInfo> handler;
        synchronized (this) {
            if (pending != timeout) {
                return;
            }
            scheduledTask = null;
            pending = null;
            handler = timeoutHandler;
        }
        if (handler != null) {
            handler.accept(timeout);
        }
    }

    @Override
    public void shutdown() {
        cancel();
        scheduler.shutdownNow();
    }
}
