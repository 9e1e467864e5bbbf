package com.bftchain.timer;

import java.util.function.Consumer;

/**
 * Round timer driven by a fake clock. Nothing fires until {@link #advance(long)}
 * moves the clock past the deadline, which makes timeouts deterministic in
 * tests.
 */
public class SimulatedRoundTimer implements RoundTimer {
    private long now = 0;
    private long deadline = -1;
    private TimeoutInfo pending;
    private Consumer<TimeoutInfo> timeoutHandler;
    private int scheduledCount = 0;

    @Override
    public synchronized void schedule(TimeoutInfo timeout) {
        if (timeoutHandler == null) {
            throw new IllegalStateException("Timeout handler not set");
        }
        pending = timeout;
        deadline = now + timeout.getDurationMs();
        scheduledCount++;
    }

    @Override
    public synchronized void cancel() {
        pending = null;
        deadline = -1;
    }

    @Override
    public synchronized void setTimeoutHandler(Consumer<TimeoutInfo> handler) {
        this.timeoutHandler = handler;
    }

    @Override
    public void shutdown() {
        cancel();
    }

    /**
     * Moves the clock forward, firing the pending timeout if its deadline is
     * reached. A handler that schedules a new timeout which is also within
     * the window fires it as well.
     */
    public void advance(long millis) {
        long target;
        synchronized (this) {
            target = now + millis;
        }
        while (true) {
            TimeoutInfo due;
            Consumer<TimeoutInfo> handler;
            synchronized (this) {
                if (pending == null || deadline > target) {
                    now = target;
                    return;
                }
                now = deadline;
                due = pending;
                handler = timeoutHandler;
                pending = null;
                deadline = -1;
            }
            handler.accept(due);
        }
    }

    /**
     * Fires the pending timeout immediately, whatever its deadline.
     *
     * @return the timeout fired, or null if none was pending
     */
    public TimeoutInfo fireNow() {
        TimeoutInfo due;
        synchronized (this) {
            if (pending == null) {
                return null;
            }
            now = Math.max(now, deadline);
            due = pending;
            pending = null;
            deadline = -1;
        }
        timeoutHandler.accept(due);
        return due;
    }

    public synchronized TimeoutInfo getPending() {
        return pending;
    }

    public synchronized long now() {
        return now;
    }

    public synchronized int getScheduledCount() {
        return scheduledCount;
    }
}
